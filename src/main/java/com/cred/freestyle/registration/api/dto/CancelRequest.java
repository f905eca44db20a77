package com.cred.freestyle.registration.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Optional body for a payment cancellation.
 *
 * @author Registration Team
 */
public class CancelRequest {

    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;

    public CancelRequest() {
    }

    public CancelRequest(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
