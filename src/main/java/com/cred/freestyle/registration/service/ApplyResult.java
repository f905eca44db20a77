package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.Registration;

/**
 * Payment and registration created together by one apply/enroll.
 *
 * @author Registration Team
 */
public class ApplyResult {

    private final Payment payment;
    private final Registration registration;

    public ApplyResult(Payment payment, Registration registration) {
        this.payment = payment;
        this.registration = registration;
    }

    public Payment getPayment() {
        return payment;
    }

    public Registration getRegistration() {
        return registration;
    }
}
