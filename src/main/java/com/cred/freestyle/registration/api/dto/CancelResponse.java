package com.cred.freestyle.registration.api.dto;

import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.service.CancelResult;

import java.time.Instant;

/**
 * Response DTO for a cancelled payment.
 * {@code registrationStatus} is COMPLETED when the offering had already been finished.
 *
 * @author Registration Team
 */
public class CancelResponse {

    private Long paymentId;
    private String paymentStatus;
    private Instant cancelledAt;
    private Long registrationId;
    private String registrationStatus;

    public CancelResponse() {
    }

    public static CancelResponse fromResult(CancelResult result) {
        Payment payment = result.getPayment();

        CancelResponse response = new CancelResponse();
        response.setPaymentId(payment.getId());
        response.setPaymentStatus(payment.getStatus().name());
        response.setCancelledAt(payment.getCancelledAt());
        result.getRegistration().ifPresent(registration -> {
            response.setRegistrationId(registration.getId());
            response.setRegistrationStatus(registration.getStatus().name());
        });
        return response;
    }

    public Long getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(Long paymentId) {
        this.paymentId = paymentId;
    }

    public String getPaymentStatus() {
        return paymentStatus;
    }

    public void setPaymentStatus(String paymentStatus) {
        this.paymentStatus = paymentStatus;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public Long getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(Long registrationId) {
        this.registrationId = registrationId;
    }

    public String getRegistrationStatus() {
        return registrationStatus;
    }

    public void setRegistrationStatus(String registrationStatus) {
        this.registrationStatus = registrationStatus;
    }
}
