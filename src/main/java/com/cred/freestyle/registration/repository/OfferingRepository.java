package com.cred.freestyle.registration.repository;

import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for Offering entity.
 *
 * @author Registration Team
 */
@Repository
public interface OfferingRepository extends JpaRepository<Offering, Long> {

    /**
     * Find an offering by id, restricted to the given kind.
     * A test id never resolves a course and vice versa.
     *
     * @param id Offering ID
     * @param kind Offering kind
     * @return Optional containing the offering if found
     */
    Optional<Offering> findByIdAndKind(Long id, OfferingKind kind);

    /**
     * Overwrite the denormalized registration count.
     *
     * @param id Offering ID
     * @param count Recomputed count
     * @return Number of rows updated
     */
    @Modifying
    @Query("UPDATE Offering o SET o.registrationCount = :count WHERE o.id = :id")
    int updateRegistrationCount(@Param("id") Long id, @Param("count") int count);
}
