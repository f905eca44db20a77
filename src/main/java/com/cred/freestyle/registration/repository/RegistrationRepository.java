package com.cred.freestyle.registration.repository;

import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.domain.model.Registration.RegistrationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Registration entity.
 * Lookups go through (user, kind, offering), which is also the unique key.
 *
 * @author Registration Team
 */
@Repository
public interface RegistrationRepository extends JpaRepository<Registration, Long> {

    /**
     * Find the user's registration for an offering, whatever its status.
     *
     * @param userId User ID
     * @param offeringKind Offering kind
     * @param offeringId Offering ID
     * @return Optional containing the registration if found
     */
    Optional<Registration> findByUserIdAndOfferingKindAndOfferingId(
            String userId,
            OfferingKind offeringKind,
            Long offeringId
    );

    /**
     * Check whether any registration exists for (user, offering).
     * Fast-path duplicate check; the unique constraint is the real guard.
     */
    boolean existsByUserIdAndOfferingKindAndOfferingId(
            String userId,
            OfferingKind offeringKind,
            Long offeringId
    );

    /**
     * Load the user's registration for an offering with a row-level write lock.
     * Used while cancelling so a concurrent completion cannot interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Registration r WHERE r.userId = :userId " +
           "AND r.offeringKind = :kind AND r.offeringId = :offeringId")
    Optional<Registration> findForUpdate(
            @Param("userId") String userId,
            @Param("kind") OfferingKind kind,
            @Param("offeringId") Long offeringId
    );

    /**
     * Move a registration from one status to COMPLETED in a single statement.
     * The status guard makes the update a no-op if another request changed the row first.
     *
     * @param id Registration ID
     * @param expected Status the row must still have (ACTIVE)
     * @param completed Target status (COMPLETED)
     * @param completedAt Completion time
     * @return 1 if the row was updated, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Registration r SET r.status = :completed, r.completedAt = :completedAt " +
           "WHERE r.id = :id AND r.status = :expected")
    int markCompleted(
            @Param("id") Long id,
            @Param("expected") RegistrationStatus expected,
            @Param("completed") RegistrationStatus completed,
            @Param("completedAt") Instant completedAt
    );

    /**
     * Count registrations for an offering excluding the given status.
     *
     * @param offeringKind Offering kind
     * @param offeringId Offering ID
     * @param status Status to exclude (CANCELLED for the public count)
     * @return Number of registrations
     */
    long countByOfferingKindAndOfferingIdAndStatusNot(
            OfferingKind offeringKind,
            Long offeringId,
            RegistrationStatus status
    );

    /**
     * Find the user's registrations for several offerings of one kind.
     * Used to attach registration times to payment history.
     */
    List<Registration> findByUserIdAndOfferingKindAndOfferingIdIn(
            String userId,
            OfferingKind offeringKind,
            Collection<Long> offeringIds
    );
}
