package com.cred.freestyle.registration.infrastructure.messaging.events;

import com.cred.freestyle.registration.domain.model.OfferingKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event representing a registration lifecycle change.
 * Published to Kafka after the database transaction commits.
 *
 * Event Types:
 * - APPLIED: registration and payment created
 * - COMPLETED: registration completed
 * - CANCELLED: payment cancelled (registration cancelled unless already completed)
 *
 * @author Registration Team
 */
public class RegistrationEvent {

    private EventType eventType;
    private String userId;
    private OfferingKind offeringKind;
    private Long offeringId;
    private Long registrationId;
    private Long paymentId;
    private BigDecimal amount;
    private String registrationStatus;
    private Instant occurredAt;

    /**
     * Default constructor for deserialization.
     */
    public RegistrationEvent() {
    }

    public RegistrationEvent(
            EventType eventType,
            String userId,
            OfferingKind offeringKind,
            Long offeringId,
            Long registrationId,
            Long paymentId,
            BigDecimal amount,
            String registrationStatus,
            Instant occurredAt
    ) {
        this.eventType = eventType;
        this.userId = userId;
        this.offeringKind = offeringKind;
        this.offeringId = offeringId;
        this.registrationId = registrationId;
        this.paymentId = paymentId;
        this.amount = amount;
        this.registrationStatus = registrationStatus;
        this.occurredAt = occurredAt;
    }

    /**
     * Partition key: all events of one offering stay ordered on one partition.
     */
    public String partitionKey() {
        return offeringKind.getCode() + ":" + offeringId;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public OfferingKind getOfferingKind() {
        return offeringKind;
    }

    public void setOfferingKind(OfferingKind offeringKind) {
        this.offeringKind = offeringKind;
    }

    public Long getOfferingId() {
        return offeringId;
    }

    public void setOfferingId(Long offeringId) {
        this.offeringId = offeringId;
    }

    public Long getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(Long registrationId) {
        this.registrationId = registrationId;
    }

    public Long getPaymentId() {
        return paymentId;
    }

    public void setPaymentId(Long paymentId) {
        this.paymentId = paymentId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getRegistrationStatus() {
        return registrationStatus;
    }

    public void setRegistrationStatus(String registrationStatus) {
        this.registrationStatus = registrationStatus;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    public enum EventType {
        APPLIED,
        COMPLETED,
        CANCELLED
    }

    @Override
    public String toString() {
        return "RegistrationEvent{" +
                "eventType=" + eventType +
                ", userId='" + userId + '\'' +
                ", offering=" + offeringKind + ":" + offeringId +
                ", registrationId=" + registrationId +
                ", paymentId=" + paymentId +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
