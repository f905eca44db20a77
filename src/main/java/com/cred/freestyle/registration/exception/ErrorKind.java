package com.cred.freestyle.registration.exception;

/**
 * Stable, machine-readable failure kinds returned to API clients in {@code details.kind}.
 *
 * @author Registration Team
 */
public enum ErrorKind {

    /** Current time is outside the offering's [start_at, end_at] window. */
    OUTSIDE_WINDOW,

    /** Requested amount differs from the offering price. */
    PRICE_MISMATCH,

    /** Amount is outside the range the payment method accepts. */
    PAYMENT_LIMIT,

    /** A registration for (user, offering) already exists. */
    ALREADY_REGISTERED,

    /** Lock busy or a concurrent request won; safe to retry later. */
    CONFLICT,

    NOT_FOUND,

    FORBIDDEN,

    ALREADY_COMPLETED,

    ALREADY_CANCELLED,

    /** Operation not allowed in the entity's current status. */
    INVALID_STATE,

    /** Lock store or database unreachable. */
    UNAVAILABLE
}
