package com.flagship.custodial_exchange.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Maps {@code Idempotency-Key} headers to the order or lobby they created.
 *
 * Keys are scoped by resource type and caller, so two callers (or an order and
 * a lobby) may use the same raw key independently.
 *
 * Lookup order:
 * 1. Redis (fast, may be unavailable)
 * 2. Database (source of truth)
 *
 * Redis failures are logged and degrade to the database path.
 */
@Service
@Slf4j
public class IdempotencyService {

    public static final String ORDER = "order";
    public static final String LOBBY = "lobby";

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final IdempotencyKeyRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Clock clock;

    public IdempotencyService(IdempotencyKeyRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              Clock clock) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    /**
     * Returns the id of the resource previously created under this key, if any.
     */
    @Transactional(readOnly = true)
    public Optional<Long> lookup(String resourceType, String caller, String idempotencyKey) {
        String scopedKey = scope(resourceType, caller, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + scopedKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", scopedKey);
                    return Optional.of(Long.parseLong(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        scopedKey, e.getMessage());
            }
        }

        Optional<Long> stored = repository.findById(scopedKey).map(IdempotencyKeyEntity::getResourceId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", scopedKey);
            cache(scopedKey, id);
        });
        return stored;
    }

    /**
     * Records the key in the caller's transaction. The Redis copy is written
     * best effort after commit, so a rolled-back create never leaves a cached
     * id behind.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void store(String resourceType, String caller, String idempotencyKey, long resourceId) {
        String scopedKey = scope(resourceType, caller, idempotencyKey);
        repository.saveAndFlush(new IdempotencyKeyEntity(scopedKey, resourceType, resourceId, clock.instant()));
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(scopedKey, resourceId);
            }
        });
    }

    static String scope(String resourceType, String caller, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller address is required");
        }
        // caller is length-prefixed: addresses may themselves contain ':'
        return resourceType + ":" + caller.length() + ":" + caller + ":" + idempotencyKey;
    }

    private void cache(String scopedKey, long resourceId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + scopedKey, String.valueOf(resourceId), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", scopedKey, e.getMessage());
        }
    }
}
