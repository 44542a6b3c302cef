package com.phillippitts.aura.service.pipeline;

/**
 * Result of running one step through {@link StepRunner}.
 *
 * <ul>
 *   <li>{@link Success} - the step returned a value</li>
 *   <li>{@link Contained} - the step failed; the run continues with the safe default</li>
 *   <li>{@link Fatal} - a foundational step failed; the run must stop</li>
 * </ul>
 *
 * @param <T> step result type
 */
public sealed interface StepOutcome<T> permits StepOutcome.Success, StepOutcome.Contained, StepOutcome.Fatal {

    record Success<T>(T value) implements StepOutcome<T> {}

    record Contained<T>(T fallback, String error) implements StepOutcome<T> {}

    record Fatal<T>(String error, Throwable cause) implements StepOutcome<T> {}

    /**
     * The step's value, the fallback for a contained failure, or null for a fatal one.
     */
    default T valueOrDefault() {
        if (this instanceof Success<T> s) {
            return s.value();
        }
        if (this instanceof Contained<T> c) {
            return c.fallback();
        }
        return null;
    }

    default boolean isFatal() {
        return this instanceof Fatal;
    }
}
