package com.cred.freestyle.registration.infrastructure.cache;

import com.cred.freestyle.registration.domain.model.OfferingKind;
import com.cred.freestyle.registration.domain.model.OfferingRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Redis cache service for non-critical registration bookkeeping.
 * Nothing stored here is authoritative; every failure is logged and swallowed.
 *
 * Cache Keys:
 * - offering:updated_ids:{kind} -> Set of offering IDs whose registration count changed
 *
 * @author Registration Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private static final String UPDATED_IDS_PREFIX = "offering:updated_ids:";

    private final StringRedisTemplate redisTemplate;

    public RedisCacheService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    static String updatedIdsKey(OfferingKind kind) {
        return UPDATED_IDS_PREFIX + kind.getCode();
    }

    /**
     * Record that an offering's registration count needs to be recomputed.
     *
     * @param offering Offering whose registrations changed
     */
    public void markOfferingUpdated(OfferingRef offering) {
        try {
            redisTemplate.opsForSet().add(updatedIdsKey(offering.getKind()), String.valueOf(offering.getId()));
            logger.debug("Marked offering {} as updated", offering);
        } catch (Exception e) {
            logger.warn("Failed to mark offering {} as updated", offering, e);
        }
    }

    /**
     * Atomically remove and return up to {@code batchSize} pending offering IDs of one kind.
     * IDs added while a sync is running stay in the set for the next run.
     *
     * @param kind Offering kind
     * @param batchSize Maximum number of IDs to pop
     * @return Popped IDs, empty on error or when nothing is pending
     */
    public Set<Long> popUpdatedOfferingIds(OfferingKind kind, int batchSize) {
        String key = updatedIdsKey(kind);
        try {
            List<String> popped = redisTemplate.opsForSet().pop(key, batchSize);
            if (popped == null || popped.isEmpty()) {
                return Collections.emptySet();
            }
            Set<Long> ids = new LinkedHashSet<>();
            for (String value : popped) {
                try {
                    ids.add(Long.valueOf(value));
                } catch (NumberFormatException e) {
                    logger.warn("Discarding malformed offering id '{}' from {}", value, key);
                }
            }
            logger.debug("Popped {} updated {} ids", ids.size(), kind.getCode());
            return ids;
        } catch (Exception e) {
            logger.error("Error popping updated offering ids from {}", key, e);
            return Collections.emptySet();
        }
    }

    /**
     * Put IDs back after a failed sync so the next run retries them.
     *
     * @param kind Offering kind
     * @param ids Offering IDs
     */
    public void requeueOfferingIds(OfferingKind kind, Set<Long> ids) {
        if (ids.isEmpty()) {
            return;
        }
        try {
            String[] values = ids.stream().map(String::valueOf).toArray(String[]::new);
            redisTemplate.opsForSet().add(updatedIdsKey(kind), values);
        } catch (Exception e) {
            logger.error("Failed to requeue {} {} ids", ids.size(), kind.getCode(), e);
        }
    }
}
