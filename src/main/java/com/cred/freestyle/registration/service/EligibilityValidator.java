package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.domain.model.PaymentMethod;
import com.cred.freestyle.registration.exception.AlreadyRegisteredException;
import com.cred.freestyle.registration.exception.EligibilityException;
import com.cred.freestyle.registration.exception.ErrorKind;
import com.cred.freestyle.registration.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Eligibility and pricing rules for apply/enroll.
 *
 * Checks, in order:
 * 1. Registration window: start_at &lt;= now &lt;= end_at (both ends inclusive)
 * 2. Price: requested amount equals the offering price as an exact decimal
 * 3. Payment method limits
 * 4. No existing registration for (user, offering), whatever its status
 *
 * @author Registration Team
 */
@Service
public class EligibilityValidator {

    private static final Logger logger = LoggerFactory.getLogger(EligibilityValidator.class);

    private final RegistrationRepository registrationRepository;

    public EligibilityValidator(RegistrationRepository registrationRepository) {
        this.registrationRepository = registrationRepository;
    }

    /**
     * Evaluate window and price without throwing.
     * Amounts are compared with {@code compareTo}, so 45000 and 45000.00 match
     * while 45000.01 does not. Zero and negative amounts never match a valid price.
     *
     * @param offering Offering being purchased
     * @param amount Requested amount
     * @param now Current time
     * @return Eligibility outcome
     */
    public Eligibility evaluate(Offering offering, BigDecimal amount, Instant now) {
        if (!offering.isAvailableAt(now)) {
            return Eligibility.OUTSIDE_WINDOW;
        }
        if (amount == null || amount.compareTo(offering.getPrice()) != 0) {
            return Eligibility.PRICE_MISMATCH;
        }
        return Eligibility.ELIGIBLE;
    }

    /**
     * Same as {@link #evaluate} but throws on any outcome other than ELIGIBLE.
     *
     * @throws EligibilityException with kind OUTSIDE_WINDOW or PRICE_MISMATCH
     */
    public void requireEligible(Offering offering, BigDecimal amount, Instant now) {
        OfferingRef ref = offering.toRef();
        switch (evaluate(offering, amount, now)) {
            case OUTSIDE_WINDOW:
                logger.warn("Rejected {}: {} is outside window [{}, {}]",
                        ref, now, offering.getStartAt(), offering.getEndAt());
                throw new EligibilityException(ErrorKind.OUTSIDE_WINDOW, ref,
                        "Registration for this " + ref.getKind().getCode() + " is not open at this time");
            case PRICE_MISMATCH:
                logger.warn("Rejected {}: amount {} does not match price {}", ref, amount, offering.getPrice());
                throw new EligibilityException(ErrorKind.PRICE_MISMATCH, ref,
                        "Payment amount " + (amount == null ? "null" : amount.toPlainString())
                                + " does not match the price " + offering.getPrice().toPlainString());
            default:
                break;
        }
    }

    /**
     * Check the amount against the payment method's accepted range.
     *
     * @throws EligibilityException with kind PAYMENT_LIMIT
     */
    public void requirePaymentMethodAccepts(Offering offering, PaymentMethod method, BigDecimal amount) {
        if (!method.accepts(amount)) {
            logger.warn("Rejected {}: {} does not accept amount {}", offering.toRef(), method.getCode(), amount);
            throw new EligibilityException(ErrorKind.PAYMENT_LIMIT, offering.toRef(),
                    String.format("%s accepts amounts between %s and %s",
                            method.getCode(),
                            method.getMinAmount().toPlainString(),
                            method.getMaxAmount().toPlainString()));
        }
    }

    /**
     * Fast-path duplicate check. The unique constraint remains the final guard.
     *
     * @throws AlreadyRegisteredException if any registration exists for (user, offering)
     */
    public void requireNotRegistered(String userId, OfferingRef offering) {
        if (registrationRepository.existsByUserIdAndOfferingKindAndOfferingId(
                userId, offering.getKind(), offering.getId())) {
            logger.warn("Rejected {}: user {} is already registered", offering, userId);
            throw new AlreadyRegisteredException(userId, offering);
        }
    }
}
