package com.cred.freestyle.registration.exception;

/**
 * Exception thrown when an operation targets an entity in a terminal state
 * (already completed, already cancelled, or cancelled when completion is requested).
 *
 * @author Registration Team
 */
public class InvalidStateException extends RegistrationException {

    private final String resourceType;
    private final Long resourceId;

    public InvalidStateException(ErrorKind kind, String resourceType, Long resourceId, String message) {
        super(kind, message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public Long getResourceId() {
        return resourceId;
    }
}
