package com.phillippitts.aura.presentation.controller;

import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.exception.PatientNotFoundException;
import com.phillippitts.aura.service.collaborator.PatientRecordLookup;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/patients")
class PatientController {

    private final PatientRecordLookup lookup;

    PatientController(PatientRecordLookup lookup) {
        this.lookup = lookup;
    }

    @GetMapping
    PatientList patients() {
        List<PatientRecord> all = lookup.findAll();
        return new PatientList(all, all.size());
    }

    @GetMapping("/{id}")
    PatientRecord patient(@PathVariable("id") int id) {
        return lookup.findById(id).orElseThrow(() -> new PatientNotFoundException(id));
    }

    record PatientList(List<PatientRecord> patients, int count) {
    }
}
