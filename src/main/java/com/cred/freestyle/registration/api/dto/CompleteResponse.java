package com.cred.freestyle.registration.api.dto;

import com.cred.freestyle.registration.domain.model.Registration;

import java.time.Instant;

/**
 * Response DTO for a completed registration.
 *
 * @author Registration Team
 */
public class CompleteResponse {

    private Long registrationId;
    private String offeringKind;
    private Long offeringId;
    private String status;
    private Instant completedAt;

    public CompleteResponse() {
    }

    public static CompleteResponse fromEntity(Registration registration) {
        CompleteResponse response = new CompleteResponse();
        response.setRegistrationId(registration.getId());
        response.setOfferingKind(registration.getOfferingKind().getCode());
        response.setOfferingId(registration.getOfferingId());
        response.setStatus(registration.getStatus().name());
        response.setCompletedAt(registration.getCompletedAt());
        return response;
    }

    public Long getRegistrationId() {
        return registrationId;
    }

    public void setRegistrationId(Long registrationId) {
        this.registrationId = registrationId;
    }

    public String getOfferingKind() {
        return offeringKind;
    }

    public void setOfferingKind(String offeringKind) {
        this.offeringKind = offeringKind;
    }

    public Long getOfferingId() {
        return offeringId;
    }

    public void setOfferingId(Long offeringId) {
        this.offeringId = offeringId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
