package com.cred.freestyle.registration.service;

/**
 * Outcome of checking an apply/enroll request against an offering's window and price.
 *
 * @author Registration Team
 */
public enum Eligibility {
    ELIGIBLE,
    OUTSIDE_WINDOW,
    PRICE_MISMATCH
}
