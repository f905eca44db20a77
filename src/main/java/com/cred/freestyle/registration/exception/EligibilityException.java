package com.cred.freestyle.registration.exception;

import com.cred.freestyle.registration.domain.model.OfferingRef;

/**
 * Exception thrown when a request fails eligibility or pricing validation
 * (outside window, price mismatch, payment method limit). Never retried.
 *
 * @author Registration Team
 */
public class EligibilityException extends RegistrationException {

    private final OfferingRef offering;

    public EligibilityException(ErrorKind kind, OfferingRef offering, String message) {
        super(kind, message);
        this.offering = offering;
    }

    public OfferingRef getOffering() {
        return offering;
    }
}
