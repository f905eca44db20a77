package com.cred.freestyle.registration.service;

import com.cred.freestyle.registration.domain.model.Offering;
import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import com.cred.freestyle.registration.domain.model.Payment;
import com.cred.freestyle.registration.domain.model.PaymentMethod;
import com.cred.freestyle.registration.domain.model.Registration;
import com.cred.freestyle.registration.exception.AlreadyRegisteredException;
import com.cred.freestyle.registration.exception.ConcurrentRequestException;
import com.cred.freestyle.registration.exception.EligibilityException;
import com.cred.freestyle.registration.exception.ErrorKind;
import com.cred.freestyle.registration.exception.InvalidStateException;
import com.cred.freestyle.registration.exception.PaymentAccessDeniedException;
import com.cred.freestyle.registration.exception.ResourceNotFoundException;
import com.cred.freestyle.registration.exception.ServiceUnavailableException;
import com.cred.freestyle.registration.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.registration.infrastructure.lock.RedisDistributedLock;
import com.cred.freestyle.registration.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.registration.infrastructure.messaging.events.RegistrationEvent;
import com.cred.freestyle.registration.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.registration.repository.PaymentRepository;
import com.cred.freestyle.registration.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RegistrationCoordinator.
 * Covers lock handling, failure classification and post-commit side effects.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RegistrationCoordinator Unit Tests")
class RegistrationCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");
    private static final String USER_ID = "user-1";
    private static final BigDecimal PRICE = new BigDecimal("45000.00");
    private static final OfferingRef TEST_REF = OfferingRef.test(1L);
    private static final String APPLY_LOCK = "lock:registration:user-1:test:1";
    private static final String CANCEL_LOCK = "lock:payment:cancel:7";

    @Mock
    private RedisDistributedLock distributedLock;

    @Mock
    private OfferingCatalog offeringCatalog;

    @Mock
    private EligibilityValidator eligibilityValidator;

    @Mock
    private RegistrationWriter registrationWriter;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private RedisCacheService cacheService;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private CloudWatchMetricsService metricsService;

    private RegistrationCoordinator coordinator;

    private Offering offering;

    @BeforeEach
    void setUp() {
        coordinator = new RegistrationCoordinator(
                distributedLock,
                offeringCatalog,
                eligibilityValidator,
                registrationWriter,
                paymentRepository,
                cacheService,
                kafkaProducerService,
                metricsService,
                Clock.fixed(NOW, ZoneOffset.UTC),
                Duration.ofSeconds(10),
                Duration.ofMillis(500),
                Duration.ofMillis(50)
        );
        offering = TestDataBuilder.offering().id(1L).price("45000.00").build();
    }

    private void lockAvailable(String key) {
        when(distributedLock.acquireLockWithRetry(eq(key), any(), any(), any())).thenReturn("token-1");
    }

    private ApplyResult applyResult() {
        Payment payment = TestDataBuilder.payment().id(7L).target(OfferingKind.TEST, 1L).build();
        Registration registration = TestDataBuilder.registration().id(9L).offering(OfferingKind.TEST, 1L).build();
        return new ApplyResult(payment, registration);
    }

    // ========================================
    // apply() Tests
    // ========================================

    @Test
    @DisplayName("apply - Success: Writes under the lock, then runs side effects")
    void apply_Success() {
        lockAvailable(APPLY_LOCK);
        when(offeringCatalog.getOffering(TEST_REF)).thenReturn(offering);
        ApplyResult expected = applyResult();
        when(registrationWriter.createPaymentAndRegistration(USER_ID, offering, PRICE, PaymentMethod.CARD, NOW))
                .thenReturn(expected);

        ApplyResult result = coordinator.apply(USER_ID, TEST_REF, PRICE, PaymentMethod.CARD);

        assertThat(result).isSameAs(expected);

        InOrder inOrder = inOrder(eligibilityValidator, registrationWriter, distributedLock, cacheService, kafkaProducerService);
        inOrder.verify(eligibilityValidator).requireEligible(offering, PRICE, NOW);
        inOrder.verify(eligibilityValidator).requirePaymentMethodAccepts(offering, PaymentMethod.CARD, PRICE);
        inOrder.verify(eligibilityValidator).requireNotRegistered(USER_ID, TEST_REF);
        inOrder.verify(registrationWriter).createPaymentAndRegistration(USER_ID, offering, PRICE, PaymentMethod.CARD, NOW);
        inOrder.verify(distributedLock).releaseLock(APPLY_LOCK, "token-1");
        inOrder.verify(cacheService).markOfferingUpdated(TEST_REF);
        inOrder.verify(kafkaProducerService).publishRegistrationEvent(any(RegistrationEvent.class));

        ArgumentCaptor<RegistrationEvent> event = ArgumentCaptor.forClass(RegistrationEvent.class);
        verify(kafkaProducerService).publishRegistrationEvent(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(RegistrationEvent.EventType.APPLIED);
        assertThat(event.getValue().getPaymentId()).isEqualTo(7L);
        assertThat(event.getValue().getRegistrationId()).isEqualTo(9L);
        assertThat(event.getValue().partitionKey()).isEqualTo("test:1");

        verify(metricsService).recordApplySuccess(OfferingKind.TEST);
        verify(metricsService).recordApplyLatency(eq(OfferingKind.TEST), anyLong());
    }

    @Test
    @DisplayName("apply - Lock busy: Throws Conflict without touching storage")
    void apply_LockBusy() {
        when(distributedLock.acquireLockWithRetry(eq(APPLY_LOCK), any(), any(), any())).thenReturn(null);

        assertThatThrownBy(() -> coordinator.apply(USER_ID, TEST_REF, PRICE, PaymentMethod.CARD))
                .isInstanceOf(ConcurrentRequestException.class)
                .extracting(e -> ((ConcurrentRequestException) e).getKind())
                .isEqualTo(ErrorKind.CONFLICT);

        verifyNoInteractions(offeringCatalog, registrationWriter, cacheService, kafkaProducerService);
        verify(distributedLock, never()).releaseLock(anyString(), anyString());
        verify(metricsService).recordLockBusy("apply");
        verify(metricsService).recordApplyFailure(OfferingKind.TEST, "CONFLICT");
    }

    @Test
    @DisplayName("apply - Offering missing: Throws NotFound and releases the lock")
    void apply_OfferingNotFound() {
        lockAvailable(APPLY_LOCK);
        when(offeringCatalog.getOffering(TEST_REF)).thenThrow(new ResourceNotFoundException("Test", "1"));

        assertThatThrownBy(() -> coordinator.apply(USER_ID, TEST_REF, PRICE, PaymentMethod.CARD))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(distributedLock).releaseLock(APPLY_LOCK, "token-1");
        verify(metricsService).recordApplyFailure(OfferingKind.TEST, "NOT_FOUND");
        verifyNoInteractions(cacheService, kafkaProducerService);
    }

    @Test
    @DisplayName("apply - Price mismatch: Rejected before any write")
    void apply_PriceMismatch() {
        lockAvailable(APPLY_LOCK);
        when(offeringCatalog.getOffering(TEST_REF)).thenReturn(offering);
        BigDecimal wrong = new BigDecimal("44000");
        doThrow(new EligibilityException(ErrorKind.PRICE_MISMATCH, TEST_REF, "mismatch"))
                .when(eligibilityValidator).requireEligible(offering, wrong, NOW);

        assertThatThrownBy(() -> coordinator.apply(USER_ID, TEST_REF, wrong, PaymentMethod.CARD))
                .isInstanceOf(EligibilityException.class);

        verifyNoInteractions(registrationWriter);
        verify(distributedLock).releaseLock(APPLY_LOCK, "token-1");
        verify(metricsService).recordApplyFailure(OfferingKind.TEST, "PRICE_MISMATCH");
    }

    @Test
    @DisplayName("apply - Unique constraint at commit: Reported as AlreadyRegistered")
    void apply_UniqueConstraintViolation() {
        lockAvailable(APPLY_LOCK);
        when(offeringCatalog.getOffering(TEST_REF)).thenReturn(offering);
        when(registrationWriter.createPaymentAndRegistration(any(), any(), any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_registration_user_offering"));

        assertThatThrownBy(() -> coordinator.apply(USER_ID, TEST_REF, PRICE, PaymentMethod.CARD))
                .isInstanceOf(AlreadyRegisteredException.class);

        verify(distributedLock).releaseLock(APPLY_LOCK, "token-1");
        verify(metricsService).recordApplyFailure(OfferingKind.TEST, "ALREADY_REGISTERED");
        verifyNoInteractions(cacheService, kafkaProducerService);
    }

    @Test
    @DisplayName("apply - Database unreachable: Reported as Unavailable")
    void apply_DatabaseUnavailable() {
        lockAvailable(APPLY_LOCK);
        when(offeringCatalog.getOffering(TEST_REF))
                .thenThrow(new CannotCreateTransactionException("connection refused"));

        assertThatThrownBy(() -> coordinator.apply(USER_ID, TEST_REF, PRICE, PaymentMethod.CARD))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageNotContaining("connection refused");

        verify(distributedLock).releaseLock(APPLY_LOCK, "token-1");
        verify(metricsService).recordError("DATABASE_UNAVAILABLE", "apply");
        verify(metricsService).recordApplyFailure(OfferingKind.TEST, "UNAVAILABLE");
    }

    @Test
    @DisplayName("apply - Unexpected failure: Rethrown unchanged and lock released")
    void apply_UnexpectedFailure() {
        lockAvailable(APPLY_LOCK);
        when(offeringCatalog.getOffering(TEST_REF)).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> coordinator.apply(USER_ID, TEST_REF, PRICE, PaymentMethod.CARD))
                .isInstanceOf(IllegalStateException.class);

        verify(distributedLock).releaseLock(APPLY_LOCK, "token-1");
        verify(metricsService).recordApplyFailure(OfferingKind.TEST, "INTERNAL");
    }

    // ========================================
    // complete() Tests
    // ========================================

    @Test
    @DisplayName("complete - Success: Publishes COMPLETED event")
    void complete_Success() {
        when(offeringCatalog.getOffering(TEST_REF)).thenReturn(offering);
        Registration completed = TestDataBuilder.registration().id(9L).completed().build();
        when(registrationWriter.completeRegistration(USER_ID, TEST_REF, NOW)).thenReturn(completed);

        Registration result = coordinator.complete(USER_ID, TEST_REF);

        assertThat(result).isSameAs(completed);
        ArgumentCaptor<RegistrationEvent> event = ArgumentCaptor.forClass(RegistrationEvent.class);
        verify(kafkaProducerService).publishRegistrationEvent(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(RegistrationEvent.EventType.COMPLETED);
        verify(metricsService).recordCompleteSuccess(OfferingKind.TEST);
        verifyNoInteractions(distributedLock);
    }

    @Test
    @DisplayName("complete - Already completed: Failure recorded and rethrown")
    void complete_AlreadyCompleted() {
        when(offeringCatalog.getOffering(TEST_REF)).thenReturn(offering);
        when(registrationWriter.completeRegistration(USER_ID, TEST_REF, NOW))
                .thenThrow(new InvalidStateException(ErrorKind.ALREADY_COMPLETED, "Registration", 9L, "done"));

        assertThatThrownBy(() -> coordinator.complete(USER_ID, TEST_REF))
                .isInstanceOf(InvalidStateException.class);

        verify(metricsService).recordCompleteFailure(OfferingKind.TEST, "ALREADY_COMPLETED");
        verifyNoInteractions(kafkaProducerService);
    }

    // ========================================
    // cancelPayment() Tests
    // ========================================

    @Test
    @DisplayName("cancelPayment - Success: Cancels under the payment lock")
    void cancel_Success() {
        Payment payment = TestDataBuilder.payment().id(7L).userId(USER_ID).build();
        when(paymentRepository.findById(7L)).thenReturn(Optional.of(payment));
        lockAvailable(CANCEL_LOCK);

        Payment cancelled = TestDataBuilder.payment().id(7L).userId(USER_ID).cancelled().build();
        Registration registration = TestDataBuilder.registration().id(9L).cancelled().build();
        when(registrationWriter.cancelPaymentAndRegistration(7L, "reason", NOW))
                .thenReturn(new CancelResult(cancelled, registration));

        CancelResult result = coordinator.cancelPayment(USER_ID, 7L, "reason");

        assertThat(result.getPayment().isCancelled()).isTrue();
        verify(distributedLock).releaseLock(CANCEL_LOCK, "token-1");
        verify(cacheService).markOfferingUpdated(OfferingRef.test(1L));

        ArgumentCaptor<RegistrationEvent> event = ArgumentCaptor.forClass(RegistrationEvent.class);
        verify(kafkaProducerService).publishRegistrationEvent(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo(RegistrationEvent.EventType.CANCELLED);
        assertThat(event.getValue().getRegistrationStatus()).isEqualTo("CANCELLED");
        verify(metricsService).recordCancelSuccess(OfferingKind.TEST);
    }

    @Test
    @DisplayName("cancelPayment - Unknown payment: Throws NotFound before locking")
    void cancel_NotFound() {
        when(paymentRepository.findById(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator.cancelPayment(USER_ID, 7L, null))
                .isInstanceOf(ResourceNotFoundException.class);

        verifyNoInteractions(distributedLock, registrationWriter);
        verify(metricsService).recordCancelFailure("NOT_FOUND");
    }

    @Test
    @DisplayName("cancelPayment - Other user's payment: Throws Forbidden")
    void cancel_Forbidden() {
        Payment payment = TestDataBuilder.payment().id(7L).userId("someone-else").build();
        when(paymentRepository.findById(7L)).thenReturn(Optional.of(payment));

        assertThatThrownBy(() -> coordinator.cancelPayment(USER_ID, 7L, null))
                .isInstanceOf(PaymentAccessDeniedException.class);

        verifyNoInteractions(distributedLock, registrationWriter);
        verify(metricsService).recordCancelFailure("FORBIDDEN");
    }

    @Test
    @DisplayName("cancelPayment - Already cancelled: Throws ALREADY_CANCELLED")
    void cancel_AlreadyCancelled() {
        Payment payment = TestDataBuilder.payment().id(7L).userId(USER_ID).cancelled().build();
        when(paymentRepository.findById(7L)).thenReturn(Optional.of(payment));

        assertThatThrownBy(() -> coordinator.cancelPayment(USER_ID, 7L, null))
                .isInstanceOf(InvalidStateException.class)
                .extracting(e -> ((InvalidStateException) e).getKind())
                .isEqualTo(ErrorKind.ALREADY_CANCELLED);

        verifyNoInteractions(distributedLock, registrationWriter);
    }

    @Test
    @DisplayName("cancelPayment - Lock busy: Throws Conflict")
    void cancel_LockBusy() {
        Payment payment = TestDataBuilder.payment().id(7L).userId(USER_ID).build();
        when(paymentRepository.findById(7L)).thenReturn(Optional.of(payment));
        when(distributedLock.acquireLockWithRetry(eq(CANCEL_LOCK), any(), any(), any())).thenReturn(null);

        assertThatThrownBy(() -> coordinator.cancelPayment(USER_ID, 7L, null))
                .isInstanceOf(ConcurrentRequestException.class);

        verifyNoInteractions(registrationWriter);
        verify(metricsService).recordLockBusy("cancel");
        verify(metricsService).recordCancelFailure("CONFLICT");
    }

    @Test
    @DisplayName("cancelPayment - Row lock timeout: Reported as Conflict and lock released")
    void cancel_RowLockTimeout() {
        Payment payment = TestDataBuilder.payment().id(7L).userId(USER_ID).build();
        when(paymentRepository.findById(7L)).thenReturn(Optional.of(payment));
        lockAvailable(CANCEL_LOCK);
        when(registrationWriter.cancelPaymentAndRegistration(anyLong(), any(), any()))
                .thenThrow(new CannotAcquireLockException("lock timeout"));

        assertThatThrownBy(() -> coordinator.cancelPayment(USER_ID, 7L, null))
                .isInstanceOf(ConcurrentRequestException.class);

        verify(distributedLock).releaseLock(CANCEL_LOCK, "token-1");
        verifyNoInteractions(cacheService, kafkaProducerService);
    }
}
