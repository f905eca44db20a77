package com.cred.freestyle.registration.api.dto;

import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.service.ApplyResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a successful apply/enroll.
 *
 * @author Registration Team
 */
public class ApplyResponse {

    private Long paymentId;
    private Long registrationId;
    private String paymentMethod;
    private String offeringKind;
    private Long offeringId;
    private BigDecimal amount;
    private String externalTransactionId;
    private String registrationStatus;
    private Instant appliedAt;
    private Map<String, Object> transactionMetadata;

    public ApplyResponse() {
    }

    /**
     * Create response from the created payment and registration.
     *
     * @param result Apply result
     * @return ApplyResponse
     */
    public static ApplyResponse fromResult(ApplyResult result) {
        Payment payment = result.getPayment();
        Registration registration = result.getRegistration();

        ApplyResponse response = new ApplyResponse();
        response.setPaymentId(payment.getId());
        response.setRegistrationId(registration.getId());
        response.setPaymentMethod(payment.getPaymentMethod().getCode());
        response.setOfferingKind(registration.getOfferingKind().getCode());
        response.setOfferingId(registration.getOfferingId());
        response.setAmount(payment.getAmount());
        response.setExternalTransactionId(payment.getExternalTransactionId());
        response.setRegistrationStatus(registration.getStatus().name());
        response.setAppliedAt(registration.getAppliedAt());
        response.setTransactionMetadata(payment.getPaymentMethod().transactionMetadata(payment.getAmount()));
        return response;
    }

    public Long getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(Long paymentId) {
        this.paymentId = paymentId;
    }

    public Long getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(Long registrationId) {
        this.registrationId = registrationId;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public String getOfferingKind() {
        return offeringKind;
    }

    public void setOfferingKind(String offeringKind) {
        this.offeringKind = offeringKind;
    }

    public Long getOfferingId() {
        return offeringId;
    }

    public void setOfferingId(Long offeringId) {
        this.offeringId = offeringId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getExternalTransactionId() {
        return externalTransactionId;
    }

    public void setExternalTransactionId(String externalTransactionId) {
        this.externalTransactionId = externalTransactionId;
    }

    public String getRegistrationStatus() {
        return registrationStatus;
    }

    public void setRegistrationStatus(String registrationStatus) {
        this.registrationStatus = registrationStatus;
    }

    public Instant getAppliedAt() {
        return appliedAt;
    }

    public void setAppliedAt(Instant appliedAt) {
        this.appliedAt = appliedAt;
    }

    public Map<String, Object> getTransactionMetadata() {
        return transactionMetadata;
    }

    public void setTransactionMetadata(Map<String, Object> transactionMetadata) {
        this.transactionMetadata = transactionMetadata;
    }
}
