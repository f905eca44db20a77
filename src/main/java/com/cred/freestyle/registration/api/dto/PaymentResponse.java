package com.cred.freestyle.registration.api.dto;

import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.service.PaymentHistoryService;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment history item.
 *
 * @author Registration Team
 */
public class PaymentResponse {

    private Long paymentId;
    private String targetKind;
    private Long targetId;
    private BigDecimal amount;
    private String paymentMethod;
    private String status;
    private String externalTransactionId;
    private Instant paidAt;
    private Instant cancelledAt;
    private String refundReason;
    private Instant registeredAt;

    public PaymentResponse() {
    }

    public static PaymentResponse fromEntry(PaymentHistoryService.Entry entry) {
        Payment payment = entry.getPayment();

        PaymentResponse response = new PaymentResponse();
        response.setPaymentId(payment.getId());
        response.setTargetKind(payment.getTargetKind().getCode());
        response.setTargetId(payment.getTargetId());
        response.setAmount(payment.getAmount());
        response.setPaymentMethod(payment.getPaymentMethod().getCode());
        response.setStatus(payment.getStatus().name());
        response.setExternalTransactionId(payment.getExternalTransactionId());
        response.setPaidAt(payment.getPaidAt());
        response.setCancelledAt(payment.getCancelledAt());
        response.setRefundReason(payment.getRefundReason());
        response.setRegisteredAt(entry.getRegisteredAt());
        return response;
    }

    public Long getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(Long paymentId) {
        this.paymentId = paymentId;
    }

    public String getTargetKind() {
        return targetKind;
    }

    public void setTargetKind(String targetKind) {
        this.targetKind = targetKind;
    }

    public Long getTargetId() {
        return targetId;
    }

    public void setTargetId(Long targetId) {
        this.targetId = targetId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getExternalTransactionId() {
        return externalTransactionId;
    }

    public void setExternalTransactionId(String externalTransactionId) {
        this.externalTransactionId = externalTransactionId;
    }

    public Instant getPaidAt() {
        return paidAt;
    }

    public void setPaidAt(Instant paidAt) {
        this.paidAt = paidAt;
    }

    public Instant getCancelledAt() {
        return cancelledAt;
    }

    public void setCancelledAt(Instant cancelledAt) {
        this.cancelledAt = cancelledAt;
    }

    public String getRefundReason() {
        return refundReason;
    }

    public void setRefundReason(String refundReason) {
        this.refundReason = refundReason;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }
}
