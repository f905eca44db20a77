package com.cred.freestyle.registration.infrastructure.scheduler;

import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.Registration.RegistrationStatus;
import com.cred.freestyle.registration.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.registration.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.registration.repository.OfferingRepository;
import com.cred.freestyle.registration.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Set;

/**
 * Scheduled job that refreshes the denormalized {@code offerings.registration_count}.
 *
 * Every successful apply, enroll or cancel marks its offering in Redis
 * ({@code offering:updated_ids:{kind}}). This job:
 * 1. Pops pending IDs per kind in batches
 * 2. Counts non-cancelled registrations for each offering
 * 3. Writes the count back to the offering row
 * 4. Requeues the batch if the database write fails
 *
 * The count is informational and may lag by one interval; registration
 * correctness never depends on it.
 *
 * @author Registration Team
 */
@Service
public class RegistrationCountSyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationCountSyncScheduler.class);

    private final RedisCacheService cacheService;
    private final RegistrationRepository registrationRepository;
    private final OfferingRepository offeringRepository;
    private final TransactionTemplate transactionTemplate;
    private final CloudWatchMetricsService metricsService;

    @Value("${registration.count-sync.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${registration.count-sync.batch-size:500}")
    private int batchSize;

    public RegistrationCountSyncScheduler(
            RedisCacheService cacheService,
            RegistrationRepository registrationRepository,
            OfferingRepository offeringRepository,
            TransactionTemplate transactionTemplate,
            CloudWatchMetricsService metricsService
    ) {
        this.cacheService = cacheService;
        this.registrationRepository = registrationRepository;
        this.offeringRepository = offeringRepository;
        this.transactionTemplate = transactionTemplate;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${registration.count-sync.interval-ms:60000}")
    public void scheduledSync() {
        if (!schedulerEnabled) {
            logger.debug("Registration count sync is disabled");
            return;
        }
        syncNow();
    }

    /**
     * Run one full sync pass over both offering kinds.
     *
     * @return Number of offerings whose count was rewritten
     */
    public int syncNow() {
        long startTime = System.currentTimeMillis();
        int synced = 0;

        for (OfferingKind kind : OfferingKind.values()) {
            synced += syncKind(kind);
        }

        long duration = System.currentTimeMillis() - startTime;
        if (synced > 0) {
            logger.info("Registration count sync completed: {} offerings, duration: {}ms", synced, duration);
        }
        metricsService.recordCountSync(synced, duration);
        return synced;
    }

    private int syncKind(OfferingKind kind) {
        int synced = 0;
        Set<Long> ids = cacheService.popUpdatedOfferingIds(kind, batchSize);

        while (!ids.isEmpty()) {
            Set<Long> batch = ids;
            try {
                Integer written = transactionTemplate.execute(status -> writeCounts(kind, batch));
                synced += written != null ? written : 0;
            } catch (Exception e) {
                logger.error("Failed to sync registration counts for {} {} offerings",
                        batch.size(), kind.getCode(), e);
                metricsService.recordError("COUNT_SYNC_ERROR", "syncRegistrationCounts");
                cacheService.requeueOfferingIds(kind, batch);
                return synced;
            }
            if (batch.size() < batchSize) {
                break;
            }
            ids = cacheService.popUpdatedOfferingIds(kind, batchSize);
        }
        return synced;
    }

    private int writeCounts(OfferingKind kind, Set<Long> offeringIds) {
        int written = 0;
        for (Long offeringId : offeringIds) {
            long count = registrationRepository.countByOfferingKindAndOfferingIdAndStatusNot(
                    kind, offeringId, RegistrationStatus.CANCELLED);
            int updated = offeringRepository.updateRegistrationCount(offeringId, (int) count);
            if (updated > 0) {
                written++;
                logger.debug("Updated {} {} registration count to {}", kind.getCode(), offeringId, count);
            } else {
                logger.warn("Offering {} {} no longer exists; skipping count sync", kind.getCode(), offeringId);
            }
        }
        return written;
    }
}
