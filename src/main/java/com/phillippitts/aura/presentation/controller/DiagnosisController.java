package com.phillippitts.aura.presentation.controller;

import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.service.pipeline.DiagnosticPipeline;
import com.phillippitts.aura.service.pipeline.StepRunner;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.UUID;

/**
 * Starts diagnostic runs. Each request gets a fresh run id.
 *
 * <p>Status mapping: a run that stopped at patient lookup is 404, one that stopped at symptom
 * extraction is 400. Any other run returns 200, with {@code error} set when a later step
 * failed or the run timed out.
 */
@RestController
@RequestMapping("/api")
class DiagnosisController {

    private static final Logger LOG = LogManager.getLogger(DiagnosisController.class);

    private final DiagnosticPipeline pipeline;

    DiagnosisController(DiagnosticPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping(path = "/diagnose", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<RunRecord> diagnose(@Valid @RequestBody DiagnoseRequest request) {
        return respond(pipeline.run(newRunId(), request.patientId(), request.symptomsText(), null));
    }

    @PostMapping(path = "/diagnose", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<RunRecord> diagnoseWithImage(@RequestParam("patientId") int patientId,
                                                @RequestParam("symptomsText") String symptomsText,
                                                @RequestPart(name = "image", required = false) MultipartFile image)
            throws IOException {
        if (symptomsText.isBlank()) {
            throw new IllegalArgumentException("symptomsText must not be blank");
        }
        byte[] bytes = image == null || image.isEmpty() ? null : image.getBytes();
        return respond(pipeline.run(newRunId(), patientId, symptomsText, bytes));
    }

    private static ResponseEntity<RunRecord> respond(RunRecord record) {
        HttpStatus status = statusFor(record);
        if (status != HttpStatus.OK) {
            LOG.info("Run {} stopped early: {}", record.runId(), record.error());
        }
        return ResponseEntity.status(status).body(record);
    }

    static HttpStatus statusFor(RunRecord record) {
        if (StepRunner.failedAt(record, DiagnosticPipeline.PATIENT_STEP)) {
            return HttpStatus.NOT_FOUND;
        }
        if (StepRunner.failedAt(record, DiagnosticPipeline.SYMPTOM_STEP)) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.OK;
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }

    record DiagnoseRequest(
            @NotNull(message = "patientId is required") Integer patientId,
            @NotBlank(message = "symptomsText is required") String symptomsText
    ) {}
}
