package com.cred.freestyle.registration.exception;

import com.cred.freestyle.registration.domain.model.OfferingRef;

/**
 * Exception thrown when the user already holds a registration for the offering.
 * Raised by the fast-path check and by the unique constraint at commit.
 *
 * @author Registration Team
 */
public class AlreadyRegisteredException extends RegistrationException {

    private final String userId;
    private final OfferingRef offering;

    public AlreadyRegisteredException(String userId, OfferingRef offering) {
        super(ErrorKind.ALREADY_REGISTERED,
                String.format("User %s is already registered for %s %d",
                        userId, offering.getKind().getCode(), offering.getId()));
        this.userId = userId;
        this.offering = offering;
    }

    public String getUserId() {
        return userId;
    }

    public OfferingRef getOffering() {
        return offering;
    }
}
