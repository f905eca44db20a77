package com.cred.freestyle.registration.exception;

/**
 * Exception thrown when the lock for a resource could not be acquired in time.
 * The caller may retry later; the server never retries on its own.
 *
 * @author Registration Team
 */
public class ConcurrentRequestException extends RegistrationException {

    private final String lockKey;

    public ConcurrentRequestException(String lockKey) {
        super(ErrorKind.CONFLICT, "Another request is in progress for this resource. Please retry shortly");
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
