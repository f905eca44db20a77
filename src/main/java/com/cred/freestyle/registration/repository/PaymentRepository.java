package com.cred.freestyle.registration.repository;

import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.Payment.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Payment entity.
 *
 * @author Registration Team
 */
@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    /**
     * Load a payment with a row-level write lock (SELECT ... FOR UPDATE).
     *
     * @param id Payment ID
     * @return Optional containing the locked payment
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.id = :id")
    Optional<Payment> findByIdForUpdate(@Param("id") Long id);

    /**
     * Payment history for a user, newest first.
     * Every filter is always bound: callers pass all statuses and kinds, and open date bounds,
     * when the request leaves a filter out.
     *
     * @param userId Payment owner
     * @param statuses Statuses to include
     * @param kinds Target kinds to include
     * @param from Inclusive lower bound on paid_at
     * @param to Exclusive upper bound on paid_at
     * @return Matching payments, newest first
     */
    @Query("SELECT p FROM Payment p WHERE p.userId = :userId " +
           "AND p.status IN :statuses AND p.targetKind IN :kinds " +
           "AND p.paidAt >= :from AND p.paidAt < :to " +
           "ORDER BY p.paidAt DESC")
    List<Payment> findHistory(
            @Param("userId") String userId,
            @Param("statuses") Collection<PaymentStatus> statuses,
            @Param("kinds") Collection<OfferingKind> kinds,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    List<Payment> findByUserIdAndTargetKindAndTargetId(String userId, OfferingKind targetKind, Long targetId);
}
