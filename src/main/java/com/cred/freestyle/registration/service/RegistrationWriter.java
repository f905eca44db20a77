package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.PaymentMethod;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.registration.exception.ErrorKind;
import com.cred.freestyle.registration.exception.InvalidStateException;
import com.cred.freestyle.registration.exception.ResourceNotFoundException;
import com.cred.freestyle.registration.repository.PaymentRepository;
import com.cred.freestyle.registration.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Atomic storage units of the registration flow.
 * Each public method is one database transaction: either every row change in it
 * becomes visible or none does. Locking and error classification stay in
 * {@link RegistrationCoordinator}, which calls these methods while holding the lock.
 *
 * @author Registration Team
 */
@Service
public class RegistrationWriter {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationWriter.class);

    private final PaymentRepository paymentRepository;
    private final RegistrationRepository registrationRepository;

    public RegistrationWriter(PaymentRepository paymentRepository, RegistrationRepository registrationRepository) {
        this.paymentRepository = paymentRepository;
        this.registrationRepository = registrationRepository;
    }

    /**
     * Insert a PAID payment and an ACTIVE registration.
     * Both inserts are flushed so a unique-constraint violation surfaces here as a
     * {@code DataIntegrityViolationException} and rolls the payment back with it.
     *
     * @param userId Paying user
     * @param offering Offering being purchased
     * @param amount Paid amount (already validated)
     * @param method Payment method
     * @param now Payment and application time
     * @return Created payment and registration
     */
    @Transactional
    public ApplyResult createPaymentAndRegistration(
            String userId,
            Offering offering,
            BigDecimal amount,
            PaymentMethod method,
            Instant now
    ) {
        OfferingRef ref = offering.toRef();

        Payment payment = Payment.builder()
                .userId(userId)
                .targetKind(ref.getKind())
                .targetId(ref.getId())
                .amount(amount)
                .paymentMethod(method)
                .externalTransactionId(method.externalTransactionId(userId, ref.getId()))
                .status(Payment.PaymentStatus.PAID)
                .paidAt(now)
                .build();
        payment = paymentRepository.saveAndFlush(payment);

        Registration registration = Registration.builder()
                .userId(userId)
                .offeringKind(ref.getKind())
                .offeringId(ref.getId())
                .status(RegistrationStatus.ACTIVE)
                .appliedAt(now)
                .build();
        registration = registrationRepository.saveAndFlush(registration);

        logger.info("Created payment {} and registration {} for user {} on {}",
                payment.getId(), registration.getId(), userId, ref);
        return new ApplyResult(payment, registration);
    }

    /**
     * Cancel a payment and its paired registration under row locks.
     * Re-checks the payment status after locking the row, since a concurrent
     * cancel may have committed between the caller's pre-check and this transaction.
     * A completed registration is left completed.
     *
     * @param paymentId Payment ID
     * @param reason Optional reversal reason
     * @param now Cancellation time
     * @return Cancelled payment and the paired registration, if any
     */
    @Transactional
    public CancelResult cancelPaymentAndRegistration(Long paymentId, String reason, Instant now) {
        Payment payment = paymentRepository.findByIdForUpdate(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", String.valueOf(paymentId)));

        if (payment.isCancelled()) {
            throw alreadyCancelled(paymentId);
        }
        payment.cancel(now, reason);
        paymentRepository.save(payment);

        OfferingRef target = payment.targetRef();
        Registration registration = registrationRepository
                .findForUpdate(payment.getUserId(), target.getKind(), target.getId())
                .orElse(null);

        if (registration == null) {
            logger.warn("Payment {} cancelled but no registration found for user {} on {}",
                    paymentId, payment.getUserId(), target);
        } else if (registration.cancel(now)) {
            registrationRepository.save(registration);
        } else {
            logger.info("Registration {} is {}; leaving it unchanged while cancelling payment {}",
                    registration.getId(), registration.getStatus(), paymentId);
        }

        logger.info("Cancelled payment {} for user {} on {}", paymentId, payment.getUserId(), target);
        return new CancelResult(payment, registration);
    }

    /**
     * Move the user's registration for an offering from ACTIVE to COMPLETED.
     * Uses a status-guarded update, so of two racing completions exactly one wins
     * and the other is classified from the row it finds afterwards.
     *
     * @param userId Registered user
     * @param ref Offering reference
     * @param now Completion time
     * @return Completed registration
     */
    @Transactional
    public Registration completeRegistration(String userId, OfferingRef ref, Instant now) {
        Registration registration = findRegistration(userId, ref);
        requireCompletable(registration);

        int updated = registrationRepository.markCompleted(
                registration.getId(), RegistrationStatus.ACTIVE, RegistrationStatus.COMPLETED, now);

        Registration current = findRegistration(userId, ref);
        if (updated == 0) {
            requireCompletable(current);
            throw new InvalidStateException(ErrorKind.INVALID_STATE, "Registration", current.getId(),
                    "Registration could not be completed in status " + current.getStatus());
        }

        logger.info("Completed registration {} for user {} on {}", current.getId(), userId, ref);
        return current;
    }

    private Registration findRegistration(String userId, OfferingRef ref) {
        return registrationRepository
                .findByUserIdAndOfferingKindAndOfferingId(userId, ref.getKind(), ref.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Registration",
                        userId + "/" + ref.asKey()));
    }

    private void requireCompletable(Registration registration) {
        if (registration.getStatus() == RegistrationStatus.COMPLETED) {
            throw new InvalidStateException(ErrorKind.ALREADY_COMPLETED, "Registration", registration.getId(),
                    "Registration is already completed");
        }
        if (registration.getStatus() == RegistrationStatus.CANCELLED) {
            throw new InvalidStateException(ErrorKind.INVALID_STATE, "Registration", registration.getId(),
                    "A cancelled registration cannot be completed");
        }
    }

    static InvalidStateException alreadyCancelled(Long paymentId) {
        return new InvalidStateException(ErrorKind.ALREADY_CANCELLED, "Payment", paymentId,
                "Payment is already cancelled");
    }
}
