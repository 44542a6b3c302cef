package com.phillippitts.aura.exception;

/**
 * Base exception for all application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AuraException extends RuntimeException {

    public AuraException(String message) {
        super(message);
    }

    public AuraException(String message, Throwable cause) {
        super(message, cause);
    }

    public AuraException(Throwable cause) {
        super(cause);
    }
}
