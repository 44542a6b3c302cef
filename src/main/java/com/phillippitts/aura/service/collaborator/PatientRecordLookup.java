package com.phillippitts.aura.service.collaborator;

import com.phillippitts.aura.domain.PatientRecord;

import java.util.List;
import java.util.Optional;

/**
 * Key-value lookup of patient records by id.
 */
public interface PatientRecordLookup {

    /**
     * @return the full record, or empty when no patient has this id
     */
    Optional<PatientRecord> findById(int patientId);

    /**
     * @return every known record in store order; empty when the store is empty
     */
    List<PatientRecord> findAll();
}
