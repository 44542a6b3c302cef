package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.PatientRecord;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.domain.StructuredSymptoms;
import com.phillippitts.aura.domain.TriageLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticRunTest {

    @Test
    void freshRunSnapshotHasInputsOnly() {
        RunRecord r = new DiagnosticRun("run-1", 3, "fever", null).snapshot();

        assertThat(r.runId()).isEqualTo("run-1");
        assertThat(r.patientId()).isEqualTo(3);
        assertThat(r.imageSupplied()).isFalse();
        assertThat(r.structuredSymptoms()).isNull();
        assertThat(r.literatureEvidence()).isEmpty();
        assertThat(r.finalReport()).isNull();
        assertThat(r.triageLevel()).isNull();
        assertThat(r.drugWarnings()).isNull();
        assertThat(r.error()).isNull();
    }

    @Test
    void emptyImageCountsAsNoImage() {
        assertThat(new DiagnosticRun("r", 1, "x", new byte[0]).hasImage()).isFalse();
        assertThat(new DiagnosticRun("r", 1, "x", new byte[]{1}).snapshot().imageSupplied()).isTrue();
    }

    @Test
    void imageBytesAreCopied() {
        byte[] image = {1, 2, 3};
        DiagnosticRun run = new DiagnosticRun("r", 1, "x", image);
        image[0] = 9;

        assertThat(run.imageBytes()).containsExactly(1, 2, 3);
    }

    @Test
    void outputFieldsAreSetOnce() {
        DiagnosticRun run = new DiagnosticRun("r", 1, "x", null);
        run.setStructuredSymptoms(StructuredSymptoms.empty());
        run.setPatientRecord(new PatientRecord(1, "A", 5, "Female", "", ""));
        run.setLiteratureEvidence(List.of());

        assertThatThrownBy(() -> run.setStructuredSymptoms(StructuredSymptoms.empty()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("structuredSymptoms");
        assertThatThrownBy(() -> run.setPatientRecord(new PatientRecord(1, "A", 5, "Female", "", "")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.setLiteratureEvidence(List.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reportAndTriageAreSetTogether() {
        DiagnosticRun run = new DiagnosticRun("r", 1, "x", null);
        run.setFinalReport("report", TriageLevel.ROUTINE);

        RunRecord r = run.snapshot();
        assertThat(r.finalReport()).isEqualTo("report");
        assertThat(r.triageLevel()).isEqualTo(TriageLevel.ROUTINE);
        assertThatThrownBy(() -> run.setFinalReport("again", TriageLevel.URGENT))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reportMayBeAmendedOnceAfterItIsSet() {
        DiagnosticRun run = new DiagnosticRun("r", 1, "x", null);
        assertThatThrownBy(() -> run.amendFinalReport("x")).isInstanceOf(IllegalStateException.class);

        run.setFinalReport("report", TriageLevel.ROUTINE);
        run.amendFinalReport("report + warnings");

        assertThat(run.finalReport()).isEqualTo("report + warnings");
        assertThatThrownBy(() -> run.amendFinalReport("y")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void firstErrorWins() {
        DiagnosticRun run = new DiagnosticRun("r", 1, "x", null);

        assertThat(run.recordError("first")).isTrue();
        assertThat(run.recordError("second")).isFalse();
        assertThat(run.snapshot().error()).isEqualTo("first");
    }

    @Test
    void concurrentErrorsRecordExactlyOne() throws Exception {
        DiagnosticRun run = new DiagnosticRun("r", 1, "x", null);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<String> messages = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String msg = "error-" + i;
            messages.add(msg);
            pool.submit(() -> {
                start.await();
                if (run.recordError(msg)) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(winners.get()).isEqualTo(1);
        assertThat(messages).contains(run.error());
    }
}
