package com.cred.freestyle.registration.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Offering entity representing a purchasable, time-bounded test or course.
 * Price and window are read by the registration flow; edits are an administrative concern.
 *
 * @author Registration Team
 */
@Entity
@Table(name = "offerings", indexes = {
    @Index(name = "idx_offering_kind", columnList = "kind"),
    @Index(name = "idx_offering_window", columnList = "start_at, end_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Offering {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "offering_id")
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private OfferingKind kind;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Price in KRW. Requested payment amounts must match it exactly.
     */
    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false)
    private Instant endAt;

    /**
     * Denormalized number of non-cancelled registrations.
     * Refreshed periodically by the count sync job, so it may lag behind.
     */
    @Column(name = "registration_count", nullable = false)
    @Builder.Default
    private Integer registrationCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (registrationCount == null) {
            registrationCount = 0;
        }
        if (startAt != null && endAt != null && !startAt.isBefore(endAt)) {
            throw new IllegalStateException("Offering start_at must be before end_at");
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Check whether the offering accepts registrations at the given instant.
     * Both window boundaries are inclusive.
     *
     * @param now Instant to check
     * @return true if start_at &lt;= now &lt;= end_at
     */
    public boolean isAvailableAt(Instant now) {
        return !now.isBefore(startAt) && !now.isAfter(endAt);
    }

    public OfferingRef toRef() {
        return OfferingRef.of(kind, id);
    }
}
