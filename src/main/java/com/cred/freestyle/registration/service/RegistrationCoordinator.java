package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.PaymentMethod;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.exception.AlreadyRegisteredException;
import com.cred.freestyle.registration.exception.ConcurrentRequestException;
import com.cred.freestyle.registration.exception.PaymentAccessDeniedException;
import com.cred.freestyle.registration.exception.RegistrationException;
import com.cred.freestyle.registration.exception.ResourceNotFoundException;
import com.cred.freestyle.registration.exception.ServiceUnavailableException;
import com.cred.freestyle.registration.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.registration.infrastructure.lock.RedisDistributedLock;
import com.cred.freestyle.registration.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.registration.infrastructure.messaging.events.RegistrationEvent;
import com.cred.freestyle.registration.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.registration.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Transaction coordinator for apply/enroll, complete and cancel.
 *
 * Apply/Enroll Flow:
 * 1. Acquire lock:registration:{userId}:{kind}:{offeringId} (busy -> Conflict)
 * 2. Load offering (NotFound), check window, price and payment method limits
 * 3. Fast-path duplicate check (AlreadyRegistered)
 * 4. One transaction: insert Payment + Registration (unique constraint -> AlreadyRegistered)
 * 5. Release lock, then mark the offering for count sync, publish event, record metrics
 *
 * Cancel Flow:
 * 1. Load payment (NotFound), check owner (Forbidden) and status (AlreadyCancelled)
 * 2. Acquire lock:payment:cancel:{paymentId} (busy -> Conflict)
 * 3. One transaction under row locks: cancel payment, cancel the paired registration unless completed
 * 4. Release lock, then side effects
 *
 * Complete takes no distributed lock; a status-guarded update decides races.
 *
 * This class is deliberately not transactional: the lock is held across the whole
 * transaction owned by {@link RegistrationWriter}, and released only after commit or rollback.
 *
 * @author Registration Team
 */
@Service
public class RegistrationCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationCoordinator.class);

    private final RedisDistributedLock distributedLock;
    private final OfferingCatalog offeringCatalog;
    private final EligibilityValidator eligibilityValidator;
    private final RegistrationWriter registrationWriter;
    private final PaymentRepository paymentRepository;
    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;
    private final CloudWatchMetricsService metricsService;
    private final Clock clock;

    private final Duration lockTtl;
    private final Duration lockWaitTimeout;
    private final Duration lockBackoff;

    public RegistrationCoordinator(
            RedisDistributedLock distributedLock,
            OfferingCatalog offeringCatalog,
            EligibilityValidator eligibilityValidator,
            RegistrationWriter registrationWriter,
            PaymentRepository paymentRepository,
            RedisCacheService cacheService,
            KafkaProducerService kafkaProducerService,
            CloudWatchMetricsService metricsService,
            Clock clock,
            @Value("${registration.lock.ttl:PT10S}") Duration lockTtl,
            @Value("${registration.lock.wait-timeout:PT0.5S}") Duration lockWaitTimeout,
            @Value("${registration.lock.backoff:PT0.05S}") Duration lockBackoff
    ) {
        this.distributedLock = distributedLock;
        this.offeringCatalog = offeringCatalog;
        this.eligibilityValidator = eligibilityValidator;
        this.registrationWriter = registrationWriter;
        this.paymentRepository = paymentRepository;
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.lockTtl = lockTtl;
        this.lockWaitTimeout = lockWaitTimeout;
        this.lockBackoff = lockBackoff;
    }

    /**
     * Apply to a test or enroll in a course by paying for it.
     *
     * @param userId Authenticated user
     * @param ref Offering reference
     * @param amount Requested amount, must equal the offering price
     * @param method Payment method
     * @return Created payment and registration
     * @throws ConcurrentRequestException if the lock is busy
     * @throws ResourceNotFoundException if the offering does not exist
     * @throws com.cred.freestyle.registration.exception.EligibilityException on window, price or method limit failure
     * @throws AlreadyRegisteredException if the user already holds a registration for the offering
     * @throws ServiceUnavailableException if the database is unreachable
     */
    public ApplyResult apply(String userId, OfferingRef ref, BigDecimal amount, PaymentMethod method) {
        long startTime = System.currentTimeMillis();
        String lockKey = RedisDistributedLock.registrationKey(userId, ref.asKey());

        logger.info("Apply request: user={}, offering={}, amount={}, method={}",
                userId, ref, amount, method.getCode());

        String lockToken = distributedLock.acquireLockWithRetry(lockKey, lockTtl, lockWaitTimeout, lockBackoff);
        if (lockToken == null) {
            metricsService.recordLockBusy("apply");
            metricsService.recordApplyFailure(ref.getKind(), "CONFLICT");
            logger.warn("Apply rejected, lock busy: {}", lockKey);
            throw new ConcurrentRequestException(lockKey);
        }

        ApplyResult result;
        try {
            Offering offering = offeringCatalog.getOffering(ref);
            Instant now = clock.instant();

            eligibilityValidator.requireEligible(offering, amount, now);
            eligibilityValidator.requirePaymentMethodAccepts(offering, method, amount);
            eligibilityValidator.requireNotRegistered(userId, ref);

            result = registrationWriter.createPaymentAndRegistration(userId, offering, amount, method, now);
        } catch (DataIntegrityViolationException e) {
            logger.warn("Unique constraint rejected registration for user {} on {}", userId, ref);
            metricsService.recordApplyFailure(ref.getKind(), "ALREADY_REGISTERED");
            throw new AlreadyRegisteredException(userId, ref);
        } catch (RegistrationException e) {
            metricsService.recordApplyFailure(ref.getKind(), e.getKind().name());
            throw e;
        } catch (RuntimeException e) {
            RuntimeException classified = classifyStorageFailure(e, "apply", lockKey);
            metricsService.recordApplyFailure(ref.getKind(), failureReason(classified));
            throw classified;
        } finally {
            distributedLock.releaseLock(lockKey, lockToken);
        }

        Payment payment = result.getPayment();
        Registration registration = result.getRegistration();
        cacheService.markOfferingUpdated(ref);
        kafkaProducerService.publishRegistrationEvent(new RegistrationEvent(
                RegistrationEvent.EventType.APPLIED, userId, ref.getKind(), ref.getId(),
                registration.getId(), payment.getId(), payment.getAmount(),
                registration.getStatus().name(), registration.getAppliedAt()));
        metricsService.recordApplySuccess(ref.getKind());
        metricsService.recordApplyLatency(ref.getKind(), System.currentTimeMillis() - startTime);

        logger.info("Apply succeeded: user={}, offering={}, payment={}, registration={}",
                userId, ref, payment.getId(), registration.getId());
        return result;
    }

    /**
     * Mark the user's registration for an offering as completed.
     *
     * @param userId Authenticated user
     * @param ref Offering reference
     * @return Completed registration
     * @throws ResourceNotFoundException if the offering or the registration does not exist
     * @throws com.cred.freestyle.registration.exception.InvalidStateException if already completed or cancelled
     */
    public Registration complete(String userId, OfferingRef ref) {
        Registration registration;
        try {
            offeringCatalog.getOffering(ref);
            registration = registrationWriter.completeRegistration(userId, ref, clock.instant());
        } catch (RegistrationException e) {
            metricsService.recordCompleteFailure(ref.getKind(), e.getKind().name());
            logger.warn("Complete rejected for user {} on {}: {}", userId, ref, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            RuntimeException classified = classifyStorageFailure(e, "complete", null);
            metricsService.recordCompleteFailure(ref.getKind(), failureReason(classified));
            throw classified;
        }

        cacheService.markOfferingUpdated(ref);
        kafkaProducerService.publishRegistrationEvent(new RegistrationEvent(
                RegistrationEvent.EventType.COMPLETED, userId, ref.getKind(), ref.getId(),
                registration.getId(), null, null,
                registration.getStatus().name(), registration.getCompletedAt()));
        metricsService.recordCompleteSuccess(ref.getKind());
        return registration;
    }

    /**
     * Cancel a payment and reverse its registration.
     *
     * @param userId Authenticated user
     * @param paymentId Payment ID
     * @param reason Optional reason, stored as the refund reason
     * @return Cancelled payment and its registration
     * @throws ResourceNotFoundException if the payment does not exist
     * @throws PaymentAccessDeniedException if the payment belongs to another user
     * @throws com.cred.freestyle.registration.exception.InvalidStateException if already cancelled
     * @throws ConcurrentRequestException if the lock is busy
     */
    public CancelResult cancelPayment(String userId, Long paymentId, String reason) {
        String lockKey = RedisDistributedLock.paymentCancelKey(paymentId);

        String lockToken;
        try {
            requireCancellable(userId, paymentId);

            lockToken = distributedLock.acquireLockWithRetry(lockKey, lockTtl, lockWaitTimeout, lockBackoff);
            if (lockToken == null) {
                metricsService.recordLockBusy("cancel");
                logger.warn("Cancel rejected, lock busy: {}", lockKey);
                throw new ConcurrentRequestException(lockKey);
            }
        } catch (RegistrationException e) {
            metricsService.recordCancelFailure(e.getKind().name());
            throw e;
        }

        CancelResult result;
        try {
            result = registrationWriter.cancelPaymentAndRegistration(paymentId, reason, clock.instant());
        } catch (RegistrationException e) {
            metricsService.recordCancelFailure(e.getKind().name());
            throw e;
        } catch (RuntimeException e) {
            RuntimeException classified = classifyStorageFailure(e, "cancel", lockKey);
            metricsService.recordCancelFailure(failureReason(classified));
            throw classified;
        } finally {
            distributedLock.releaseLock(lockKey, lockToken);
        }

        Payment payment = result.getPayment();
        OfferingRef target = payment.targetRef();
        cacheService.markOfferingUpdated(target);
        kafkaProducerService.publishRegistrationEvent(new RegistrationEvent(
                RegistrationEvent.EventType.CANCELLED, userId, target.getKind(), target.getId(),
                result.getRegistration().map(Registration::getId).orElse(null), payment.getId(),
                payment.getAmount(),
                result.getRegistration().map(r -> r.getStatus().name()).orElse(null),
                payment.getCancelledAt()));
        metricsService.recordCancelSuccess(target.getKind());

        logger.info("Cancel succeeded: user={}, payment={}, offering={}", userId, paymentId, target);
        return result;
    }

    /**
     * Pre-lock checks for cancel. Repeated under the row lock inside the transaction.
     */
    private void requireCancellable(String userId, Long paymentId) {
        Payment existing;
        try {
            existing = paymentRepository.findById(paymentId)
                    .orElseThrow(() -> new ResourceNotFoundException("Payment", String.valueOf(paymentId)));
        } catch (RegistrationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw classifyStorageFailure(e, "cancel", RedisDistributedLock.paymentCancelKey(paymentId));
        }
        if (!existing.isOwnedBy(userId)) {
            logger.warn("User {} attempted to cancel payment {} owned by {}",
                    userId, paymentId, existing.getUserId());
            throw new PaymentAccessDeniedException(paymentId);
        }
        if (existing.isCancelled()) {
            throw RegistrationWriter.alreadyCancelled(paymentId);
        }
    }

    /**
     * Map storage failures to typed outcomes. Unrecognized failures are logged with
     * their cause and returned unchanged, so the API layer reports a generic internal error.
     */
    private RuntimeException classifyStorageFailure(RuntimeException e, String operation, String lockKey) {
        if (e instanceof CannotCreateTransactionException || e instanceof DataAccessResourceFailureException) {
            logger.error("Database unavailable during {}", operation, e);
            metricsService.recordError("DATABASE_UNAVAILABLE", operation);
            return new ServiceUnavailableException("Service temporarily unavailable. Please retry later", e);
        }
        if (e instanceof PessimisticLockingFailureException) {
            logger.warn("Row lock conflict during {}: {}", operation, e.getMessage());
            return new ConcurrentRequestException(lockKey);
        }
        logger.error("Unexpected failure during {}", operation, e);
        metricsService.recordError("INTERNAL_ERROR", operation);
        return e;
    }

    private static String failureReason(RuntimeException e) {
        return e instanceof RegistrationException ? ((RegistrationException) e).getKind().name() : "INTERNAL";
    }
}
