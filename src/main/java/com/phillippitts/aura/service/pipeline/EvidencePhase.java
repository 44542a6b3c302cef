package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.config.properties.PipelineProperties;
import com.phillippitts.aura.domain.EvidenceItem;
import com.phillippitts.aura.domain.RunRecord;
import com.phillippitts.aura.exception.CollaboratorException;
import com.phillippitts.aura.exception.PipelineTimeoutException;
import com.phillippitts.aura.service.collaborator.EvidenceSearch;
import com.phillippitts.aura.service.collaborator.ImageAnalyzer;
import com.phillippitts.aura.service.query.SearchQueryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Evidence phase: concurrent fan-out to the search backends and the image analyzer.
 *
 * <p>Branches (in launch order):
 * <ol>
 *   <li>{@value #LITERATURE_STEP} - tiered query from {@link SearchQueryBuilder#buildQuery}</li>
 *   <li>{@value #BROAD_STEP} - same query against the interdisciplinary index</li>
 *   <li>{@value #CASE_STEP} - natural-language case query</li>
 *   <li>{@value #IMAGE_STEP} - only when the run carries an image</li>
 * </ol>
 *
 * <p>Each branch runs on the evidence executor through {@link StepRunner}, so a failing branch
 * degrades to an empty result and never cancels its siblings. The join is the only
 * synchronization point. If the wait expires, unfinished branches are cancelled and their
 * running threads interrupted; their fields default to empty.
 *
 * <p>Results are assigned on the calling thread after the join, so each output field is
 * written exactly once regardless of how branches finish.
 */
public class EvidencePhase {
    private static final Logger LOG = LogManager.getLogger(EvidencePhase.class);

    static final String LITERATURE_STEP = "LitSearcher";
    static final String BROAD_STEP = "BroadLitSearcher";
    static final String CASE_STEP = "CaseSearcher";
    static final String IMAGE_STEP = "ImageAnalyzer";

    private final EvidenceSearch literatureSearch;
    private final EvidenceSearch broadSearch;
    private final EvidenceSearch caseSearch;
    private final ImageAnalyzer imageAnalyzer;
    private final SearchQueryBuilder queryBuilder;
    private final StepRunner stepRunner;
    private final Executor executor;
    private final PipelineProperties properties;

    public EvidencePhase(EvidenceSearch literatureSearch,
                         EvidenceSearch broadSearch,
                         EvidenceSearch caseSearch,
                         ImageAnalyzer imageAnalyzer,
                         SearchQueryBuilder queryBuilder,
                         StepRunner stepRunner,
                         Executor executor,
                         PipelineProperties properties) {
        this.literatureSearch = Objects.requireNonNull(literatureSearch, "literatureSearch");
        this.broadSearch = Objects.requireNonNull(broadSearch, "broadSearch");
        this.caseSearch = Objects.requireNonNull(caseSearch, "caseSearch");
        this.imageAnalyzer = Objects.requireNonNull(imageAnalyzer, "imageAnalyzer");
        this.queryBuilder = Objects.requireNonNull(queryBuilder, "queryBuilder");
        this.stepRunner = Objects.requireNonNull(stepRunner, "stepRunner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Runs all branches and merges their results into {@code run}.
     *
     * <p>Waits at most {@code min(evidence-timeout, remainingBudgetMs)}. On expiry the run's error
     * names whichever limit applied: the phase timeout or the run budget.
     *
     * <p>If the calling thread is interrupted while waiting, every branch is cancelled, the run's
     * error records a caller cancellation and the interrupt flag is restored.
     *
     * @param run               run that must already hold symptoms and the patient record
     * @param remainingBudgetMs time left in the run's budget
     * @return {@code true} when the caller cancelled the run; the run must not continue
     */
    public boolean execute(DiagnosticRun run, long remainingBudgetMs) {
        RunRecord input = run.snapshot();
        Integer age = input.patientRecord() == null ? null : input.patientRecord().age();
        String query = queryBuilder.buildQuery(input.structuredSymptoms(), age);
        String caseQuery = queryBuilder.buildCaseQuery(input.structuredSymptoms(), age);
        LOG.info("Evidence query='{}', caseQuery='{}'", query, caseQuery);

        Branch<List<EvidenceItem>> literature = searchBranch(run, input, LITERATURE_STEP,
                literatureSearch, query, properties.literatureMaxResults());
        Branch<List<EvidenceItem>> broad = searchBranch(run, input, BROAD_STEP,
                broadSearch, query, properties.broadMaxResults());
        Branch<List<EvidenceItem>> cases = searchBranch(run, input, CASE_STEP,
                caseSearch, caseQuery, properties.caseMaxResults());
        Branch<String> imaging = null;
        if (run.hasImage()) {
            byte[] image = run.imageBytes();
            imaging = launch(run, input, IMAGE_STEP, null, s -> imageAnalyzer.analyze(image).orElse(null));
        }

        List<Branch<?>> all = new ArrayList<>(List.of(literature, broad, cases));
        if (imaging != null) {
            all.add(imaging);
        }

        long waitMs = Math.min(properties.evidenceTimeoutMs(), Math.max(0L, remainingBudgetMs));
        boolean cancelled = awaitAll(run, all, waitMs, waitMs == properties.evidenceTimeoutMs());

        run.setLiteratureEvidence(orEmpty(literature.resultOrNull()));
        run.setBroadLiteratureEvidence(orEmpty(broad.resultOrNull()));
        run.setCaseEvidence(orEmpty(cases.resultOrNull()));
        if (imaging != null) {
            run.setImagingFindings(imaging.resultOrNull());
        }
        RunRecord merged = run.snapshot();
        LOG.info("Evidence merged: literature={}, broad={}, cases={}, imaging={}",
                merged.literatureEvidence().size(),
                merged.broadLiteratureEvidence().size(),
                merged.caseEvidence().size(),
                merged.imagingFindings() != null);
        return cancelled;
    }

    private Branch<List<EvidenceItem>> searchBranch(DiagnosticRun run,
                                                    RunRecord input,
                                                    String stepName,
                                                    EvidenceSearch search,
                                                    String query,
                                                    int maxResults) {
        if (query == null || query.isBlank()) {
            stepRunner.skip(run, stepName, "No structured symptoms to search.");
            return Branch.completed(List.of());
        }
        return launch(run, input, stepName, List.of(), s -> search.search(query, maxResults));
    }

    /**
     * Submits one branch. A saturated executor fails just that branch: the rejection goes through
     * the step runner as a contained failure and the branch yields {@code fallback}.
     */
    private <T> Branch<T> launch(DiagnosticRun run, RunRecord input, String stepName, T fallback,
                                 PipelineStep<T> step) {
        Supplier<T> work = () -> stepRunner.run(run, input, stepName, false, fallback, step).valueOrDefault();
        Branch<T> branch = new Branch<>();
        try {
            branch.future = CompletableFuture.supplyAsync(() -> branch.runTracked(work), executor);
        } catch (RejectedExecutionException rejected) {
            LOG.warn("Evidence executor saturated; {} not started", stepName);
            T value = stepRunner.run(run, input, stepName, false, fallback, s -> {
                throw new CollaboratorException("Evidence executor saturated", rejected);
            }).valueOrDefault();
            return Branch.completed(value);
        }
        return branch;
    }

    private boolean awaitAll(DiagnosticRun run, List<Branch<?>> branches, long waitMs, boolean phaseLimited) {
        CompletableFuture<?>[] futures = branches.stream()
                .map(b -> b.future)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            LOG.warn("Evidence phase timed out after {} ms; cancelling unfinished branches", waitMs);
            // Record before cancelling so an interrupted branch's own failure does not win
            run.recordError(phaseLimited
                    ? "Evidence phase timed out after " + waitMs + " ms"
                    : new PipelineTimeoutException(run.runId(), properties.runTimeoutMs()).getMessage());
            branches.forEach(Branch::cancel);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Evidence phase interrupted by caller; cancelling all branches");
            run.recordError(PipelineTimeoutException.cancelled(run.runId()).getMessage());
            branches.forEach(Branch::cancel);
            return true;
        } catch (ExecutionException ee) {
            // Branch failures are contained by the step runner; collect whatever completed
            LOG.debug("Evidence branch completed exceptionally: {}", ee.getMessage());
        }
        return false;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    /**
     * One evidence branch. Remembers the worker thread while running so a cancellation can
     * interrupt the blocking external call.
     */
    static final class Branch<T> {
        private CompletableFuture<T> future;
        private Thread runner;
        private boolean cancelled;

        static <T> Branch<T> completed(T value) {
            Branch<T> b = new Branch<>();
            b.future = CompletableFuture.completedFuture(value);
            return b;
        }

        T runTracked(Supplier<T> work) {
            synchronized (this) {
                if (cancelled) {
                    return null;
                }
                runner = Thread.currentThread();
            }
            try {
                return work.get();
            } finally {
                synchronized (this) {
                    runner = null;
                    if (cancelled) {
                        // Do not leak the interrupt into the pooled thread's next task
                        Thread.interrupted();
                    }
                }
            }
        }

        synchronized void cancel() {
            if (future.isDone()) {
                return;
            }
            cancelled = true;
            future.cancel(true);
            if (runner != null) {
                runner.interrupt();
            }
        }

        T resultOrNull() {
            return future.isDone() && !future.isCompletedExceptionally() ? future.getNow(null) : null;
        }
    }
}
