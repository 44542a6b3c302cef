package com.phillippitts.aura.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link CollaboratorException} with contextual details.
 *
 * <pre>
 * throw CollaboratorExceptionBuilder.create("Search request failed")
 *         .collaborator("openalex")
 *         .status(503)
 *         .durationMs(1200)
 *         .metadata("endpoint", "/works")
 *         .cause(ex)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)}.
 */
public final class CollaboratorExceptionBuilder {

    private final String message;
    private String collaborator;
    private Throwable cause;
    private Integer status;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CollaboratorExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static CollaboratorExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new CollaboratorExceptionBuilder(message);
    }

    public CollaboratorExceptionBuilder collaborator(String collaborator) {
        this.collaborator = collaborator;
        return this;
    }

    public CollaboratorExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by the collaborator.
     */
    public CollaboratorExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public CollaboratorExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value detail; null keys or values are ignored.
     */
    public CollaboratorExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public CollaboratorException build() {
        String detailedMessage = buildDetailedMessage();
        String name = collaborator != null ? collaborator : "unknown";

        if (cause != null) {
            return new CollaboratorException(detailedMessage, name, cause);
        } else {
            return new CollaboratorException(detailedMessage, name);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = status != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (status != null) {
            sb.append("status=").append(status);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
