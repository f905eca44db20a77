package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.Registration;

import java.util.Optional;

/**
 * Outcome of a payment cancellation.
 * The paired registration is absent only if it was never created or was removed out of band.
 *
 * @author Registration Team
 */
public class CancelResult {

    private final Payment payment;
    private final Registration registration;

    public CancelResult(Payment payment, Registration registration) {
        this.payment = payment;
        this.registration = registration;
    }

    public Payment getPayment() {
        return payment;
    }

    public Optional<Registration> getRegistration() {
        return Optional.ofNullable(registration);
    }
}
