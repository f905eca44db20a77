package com.cred.freestyle.registration.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registration entity: a user's claim on a test (application) or a course (enrollment).
 *
 * Lifecycle:
 * - ACTIVE: created together with its payment
 * - COMPLETED: the user finished the offering
 * - CANCELLED: the funding payment was cancelled
 *
 * Rows are never deleted. The unique constraint on (user_id, offering_kind, offering_id)
 * holds regardless of status and is the final guard against double registration.
 *
 * @author Registration Team
 */
@Entity
@Table(name = "registrations",
    uniqueConstraints = {
        @UniqueConstraint(name = Registration.USER_OFFERING_CONSTRAINT,
                columnNames = {"user_id", "offering_kind", "offering_id"})
    },
    indexes = {
        @Index(name = "idx_registration_user", columnList = "user_id"),
        @Index(name = "idx_registration_offering", columnList = "offering_kind, offering_id"),
        @Index(name = "idx_registration_status", columnList = "status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Registration {

    public static final String USER_OFFERING_CONSTRAINT = "uk_registration_user_offering";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "registration_id")
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "offering_kind", nullable = false, length = 20)
    private OfferingKind offeringKind;

    @Column(name = "offering_id", nullable = false)
    private Long offeringId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RegistrationStatus status;

    @Column(name = "applied_at", nullable = false, updatable = false)
    private Instant appliedAt;

    /**
     * Set iff status is COMPLETED.
     */
    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Set iff status is CANCELLED.
     */
    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @PrePersist
    protected void onCreate() {
        if (appliedAt == null) {
            appliedAt = Instant.now();
        }
        if (status == null) {
            status = RegistrationStatus.ACTIVE;
        }
    }

    public OfferingRef offeringRef() {
        return OfferingRef.of(offeringKind, offeringId);
    }

    /**
     * Cancel the registration.
     * A completed registration keeps its completion; only active ones move to CANCELLED.
     * Completion itself is a guarded update in {@code RegistrationRepository.markCompleted}.
     *
     * @param now Cancellation time
     * @return true if the status changed
     */
    public boolean cancel(Instant now) {
        if (status != RegistrationStatus.ACTIVE) {
            return false;
        }
        this.status = RegistrationStatus.CANCELLED;
        this.cancelledAt = now;
        return true;
    }

    /**
     * Registration status enum.
     */
    public enum RegistrationStatus {
        ACTIVE,
        COMPLETED,
        CANCELLED
    }
}
