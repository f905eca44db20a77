package com.cred.freestyle.registration.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment entity funding exactly one registration.
 * The target is a (kind, id) pair; the paired registration is found through
 * (user_id, target_kind, target_id), not through a foreign key.
 *
 * @author Registration Team
 */
@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_user_status", columnList = "user_id, status"),
    @Index(name = "idx_payment_paid_at", columnList = "paid_at"),
    @Index(name = "idx_payment_target", columnList = "target_kind, target_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id")
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_kind", nullable = false, length = 20)
    private OfferingKind targetKind;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    /**
     * Amount paid; equals the offering price at creation time.
     */
    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 50)
    private PaymentMethod paymentMethod;

    @Column(name = "external_transaction_id", length = 100)
    private String externalTransactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "paid_at", nullable = false, updatable = false)
    private Instant paidAt;

    /**
     * Set iff status is CANCELLED.
     */
    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "refund_reason", columnDefinition = "TEXT")
    private String refundReason;

    @PrePersist
    protected void onCreate() {
        if (paidAt == null) {
            paidAt = Instant.now();
        }
        if (status == null) {
            status = PaymentStatus.PAID;
        }
    }

    public OfferingRef targetRef() {
        return OfferingRef.of(targetKind, targetId);
    }

    public boolean isCancelled() {
        return status == PaymentStatus.CANCELLED;
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    /**
     * Cancel the payment.
     *
     * @param now Cancellation time
     * @param reason Optional reversal reason
     * @throws IllegalStateException if already cancelled
     */
    public void cancel(Instant now, String reason) {
        if (status == PaymentStatus.CANCELLED) {
            throw new IllegalStateException("Payment already cancelled: " + id);
        }
        this.status = PaymentStatus.CANCELLED;
        this.cancelledAt = now;
        this.refundReason = reason;
    }

    /**
     * Payment status enum.
     */
    public enum PaymentStatus {
        PAID,
        CANCELLED
    }
}
