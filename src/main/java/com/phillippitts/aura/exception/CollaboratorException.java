package com.phillippitts.aura.exception;

/**
 * Thrown when an external collaborator (search backend, generation service, record store)
 * fails: transport error, non-2xx status, or a response that cannot be parsed.
 */
public class CollaboratorException extends AuraException {

    private final String collaborator;

    public CollaboratorException(String message) {
        super(message);
        this.collaborator = "unknown";
    }

    public CollaboratorException(String message, String collaborator) {
        super(message + " (collaborator: " + collaborator + ")");
        this.collaborator = collaborator;
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
        this.collaborator = "unknown";
    }

    public CollaboratorException(String message, String collaborator, Throwable cause) {
        super(message + " (collaborator: " + collaborator + ")", cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
