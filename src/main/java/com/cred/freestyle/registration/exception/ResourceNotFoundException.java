package com.cred.freestyle.registration.exception;

/**
 * Exception thrown when a requested resource (offering, registration, payment) is not found.
 *
 * @author Registration Team
 */
public class ResourceNotFoundException extends RegistrationException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorKind.NOT_FOUND, String.format("%s with ID %s not found", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
