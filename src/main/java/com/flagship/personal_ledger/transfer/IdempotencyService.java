package com.flagship.personal_ledger.transfer;

import com.flagship.personal_ledger.transaction.TransactionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for transfer creation.
 *
 * Redis is the fast path; the unique (owner_id, idempotency_key) column on the
 * outgoing leg is the source of truth and is consulted whenever Redis misses
 * or is unavailable. Keys are scoped per owner.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transfer:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionRepository transactionRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Outgoing leg of the transfer created earlier with this key, if any.
     */
    public Optional<UUID> findTransferLeg(UUID ownerId, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(ownerId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String legId = redisTemplate.get().opsForValue().get(redisKey);
                if (legId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(legId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionRepository.findIdByIdempotencyKey(ownerId, idempotencyKey);
        stored.ifPresent(legId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(redisKey, legId);
        });
        return stored;
    }

    /**
     * Caches the key once the surrounding transaction commits, so a rolled-back
     * transfer never leaves a key behind.
     */
    public void rememberAfterCommit(UUID ownerId, String idempotencyKey, UUID legId) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(ownerId, idempotencyKey);

        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(redisKey, legId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(redisKey, legId);
            }
        });
    }

    private void cache(String redisKey, UUID legId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, legId.toString(), REDIS_TTL);
        } catch (Exception e) {
            // the database column still answers the next lookup
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static String redisKey(UUID ownerId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + ownerId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
