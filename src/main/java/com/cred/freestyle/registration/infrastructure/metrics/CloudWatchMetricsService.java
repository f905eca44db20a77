package com.cred.freestyle.registration.infrastructure.metrics;

import com.cred.freestyle.registration.domain.model.OfferingKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for the registration and payment flow.
 * Publishes to CloudWatch via Micrometer when the CloudWatch registry is configured.
 *
 * Key Metrics:
 * - registration.apply.success / failure (tagged by kind and failure reason)
 * - registration.complete.success / failure
 * - registration.cancel.success / failure
 * - registration.lock.busy
 * - registration.apply.latency, registration.count.sync.latency
 *
 * @author Registration Team
 */
@Service
public class CloudWatchMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricsService.class);

    private static final String METRIC_PREFIX = "registration.";
    private static final String APPLY_PREFIX = METRIC_PREFIX + "apply.";
    private static final String COMPLETE_PREFIX = METRIC_PREFIX + "complete.";
    private static final String CANCEL_PREFIX = METRIC_PREFIX + "cancel.";

    private final MeterRegistry meterRegistry;

    public CloudWatchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordApplySuccess(OfferingKind kind) {
        Counter.builder(APPLY_PREFIX + "success")
                .tag("kind", kind.getCode())
                .description("Successful applications and enrollments")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rejected apply/enroll.
     *
     * @param kind Offering kind
     * @param reason Failure reason (an ErrorKind name, or INTERNAL)
     */
    public void recordApplyFailure(OfferingKind kind, String reason) {
        Counter.builder(APPLY_PREFIX + "failure")
                .tag("kind", kind.getCode())
                .tag("reason", reason)
                .description("Rejected applications and enrollments")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded apply failure for {}: {}", kind.getCode(), reason);
    }

    public void recordApplyLatency(OfferingKind kind, long durationMs) {
        Timer.builder(APPLY_PREFIX + "latency")
                .tag("kind", kind.getCode())
                .description("Apply/enroll latency including lock wait")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCompleteSuccess(OfferingKind kind) {
        Counter.builder(COMPLETE_PREFIX + "success")
                .tag("kind", kind.getCode())
                .description("Completed registrations")
                .register(meterRegistry)
                .increment();
    }

    public void recordCompleteFailure(OfferingKind kind, String reason) {
        Counter.builder(COMPLETE_PREFIX + "failure")
                .tag("kind", kind.getCode())
                .tag("reason", reason)
                .description("Rejected completions")
                .register(meterRegistry)
                .increment();
    }

    public void recordCancelSuccess(OfferingKind kind) {
        Counter.builder(CANCEL_PREFIX + "success")
                .tag("kind", kind.getCode())
                .description("Cancelled payments")
                .register(meterRegistry)
                .increment();
    }

    public void recordCancelFailure(String reason) {
        Counter.builder(CANCEL_PREFIX + "failure")
                .tag("reason", reason)
                .description("Rejected payment cancellations")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a request turned away because its lock was held past the wait timeout.
     *
     * @param operation Operation name ("apply", "cancel")
     */
    public void recordLockBusy(String operation) {
        Counter.builder(METRIC_PREFIX + "lock.busy")
                .tag("operation", operation)
                .description("Requests rejected because the lock was busy")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded lock busy for operation: {}", operation);
    }

    public void recordCountSync(int offeringsSynced, long durationMs) {
        Counter.builder(METRIC_PREFIX + "count.sync.offerings")
                .description("Offerings whose registration count was recomputed")
                .register(meterRegistry)
                .increment(offeringsSynced);

        Timer.builder(METRIC_PREFIX + "count.sync.latency")
                .description("Registration count sync duration")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record an unexpected error.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR", "COUNT_SYNC_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
