package com.cred.freestyle.registration.exception;

/**
 * Base class for typed failures of the registration and payment flow.
 * Every subclass carries a stable {@link ErrorKind}.
 *
 * @author Registration Team
 */
public abstract class RegistrationException extends RuntimeException {

    private final ErrorKind kind;

    protected RegistrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RegistrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
