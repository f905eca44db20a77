package com.cred.freestyle.registration.exception;

/**
 * Exception thrown when a user acts on a payment that belongs to someone else.
 *
 * @author Registration Team
 */
public class PaymentAccessDeniedException extends RegistrationException {

    private final Long paymentId;

    public PaymentAccessDeniedException(Long paymentId) {
        super(ErrorKind.FORBIDDEN, "Only the owner of a payment can cancel it");
        this.paymentId = paymentId;
    }

    public Long getPaymentId() {
        return paymentId;
    }
}
