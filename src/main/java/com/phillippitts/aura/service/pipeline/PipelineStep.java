package com.phillippitts.aura.service.pipeline;

import com.phillippitts.aura.domain.RunRecord;

/**
 * One unit of pipeline work. Receives an immutable snapshot of the run and returns its result;
 * any {@link RuntimeException} is a step failure handled by {@link StepRunner}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface PipelineStep<T> {

    T execute(RunRecord snapshot);
}
