package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.exception.ResourceNotFoundException;
import com.cred.freestyle.registration.repository.OfferingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Offering lookup keyed by (kind, id).
 *
 * @author Registration Team
 */
@Service
public class OfferingCatalog {

    private final OfferingRepository offeringRepository;

    public OfferingCatalog(OfferingRepository offeringRepository) {
        this.offeringRepository = offeringRepository;
    }

    /**
     * Get an offering by reference.
     *
     * @param ref Offering reference
     * @return Offering
     * @throws ResourceNotFoundException if no offering of that kind has the id
     */
    @Transactional(readOnly = true)
    public Offering getOffering(OfferingRef ref) {
        return offeringRepository.findByIdAndKind(ref.getId(), ref.getKind())
                .orElseThrow(() -> new ResourceNotFoundException(
                        resourceName(ref), String.valueOf(ref.getId())));
    }

    static String resourceName(OfferingRef ref) {
        return ref.getKind() == OfferingKind.TEST ? "Test" : "Course";
    }
}
