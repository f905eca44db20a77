package com.cred.freestyle.registration.exception;

/**
 * Exception thrown when the database cannot be reached.
 * Carries no storage detail to the client; the cause is logged server-side.
 *
 * @author Registration Team
 */
public class ServiceUnavailableException extends RegistrationException {

    public ServiceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, message, cause);
    }
}
