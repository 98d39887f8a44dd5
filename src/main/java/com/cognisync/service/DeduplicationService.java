package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Detects broker redeliveries of a domain event by its messageId, using Redis.
 *
 * HOW IT WORKS:
 *   1. Before applying, call isProcessed(messageId): a read of
 *      "cognisync:msg:{messageId}"
 *   2. Key present → already applied, skip
 *   3. After the apply has committed, call markProcessed(messageId), which
 *      SETs the key with a TTL
 *
 * The key is only written once the graph change is durable. A delivery that
 * dies between the read and the commit (crash, Error, rebalance) leaves no
 * key behind, so its redelivery is applied again instead of being dropped.
 *
 * This is a fast path only; the entity mapping ledger and the relationship
 * unique key are what guarantee idempotence, including for two deliveries
 * that both pass the read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private static final String DEDUP_PREFIX = "cognisync:msg:";

    private final StringRedisTemplate redisTemplate;
    private final CognisyncProperties properties;

    public boolean isProcessed(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return false; // No messageId = can't dedup, process anyway
        }

        if (Boolean.TRUE.equals(redisTemplate.hasKey(DEDUP_PREFIX + messageId))) {
            log.warn("Duplicate delivery detected: messageId={}", messageId);
            return true;
        }
        return false;
    }

    public void markProcessed(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return;
        }
        redisTemplate.opsForValue().set(DEDUP_PREFIX + messageId, "1", properties.getDedup().getTtl());
    }
}
