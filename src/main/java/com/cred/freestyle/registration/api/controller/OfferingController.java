package com.cred.freestyle.registration.api.controller;

import com.cred.freestyle.registration.api.dto.OfferingResponse;
import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.service.OfferingCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Public offering detail endpoint.
 *
 * @author Registration Team
 */
@RestController
@RequestMapping("/api/v1/offerings")
public class OfferingController {

    private final OfferingCatalog offeringCatalog;
    private final Clock clock;

    public OfferingController(OfferingCatalog offeringCatalog, Clock clock) {
        this.offeringCatalog = offeringCatalog;
        this.clock = clock;
    }

    /**
     * Get an offering by kind ("test" or "course") and ID.
     */
    @GetMapping("/{kind}/{offeringId}")
    public ResponseEntity<OfferingResponse> getOffering(
            @PathVariable String kind,
            @PathVariable Long offeringId
    ) {
        Offering offering = offeringCatalog.getOffering(OfferingRef.of(OfferingKind.fromCode(kind), offeringId));
        return ResponseEntity.ok(OfferingResponse.fromEntity(offering, clock.instant()));
    }
}
