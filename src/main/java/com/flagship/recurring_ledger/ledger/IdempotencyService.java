package com.flagship.recurring_ledger.ledger;

import com.flagship.recurring_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps client idempotency keys of manual transactions to the transaction they created.
 *
 * Redis is the fast path; the ledger store is the source of truth, because the key is saved
 * on the transaction row itself. Redis being down only costs a database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transaction:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore store;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(LedgerStore store, Optional<RedisTemplate<String, String>> redisTemplate) {
        this.store = store;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the transaction already created with this key, if any
     * @throws ValidationException if the key is blank
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing = store.findTransactionIdByIdempotencyKey(idempotencyKey);
        existing.ifPresent(transactionId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, transactionId);
        });
        return existing;
    }

    /**
     * Caches the mapping in Redis. The database copy is written with the transaction.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new ValidationException("Transaction ID is required");
        }
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be blank");
        }
    }
}
