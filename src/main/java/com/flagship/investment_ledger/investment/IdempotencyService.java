package com.flagship.investment_ledger.investment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for investment creation.
 *
 * Redis is the fast path; the unique {@code idempotency_key} column on investments
 * is the source of truth. Redis failures degrade to the database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:investment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final InvestmentRepository investmentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(InvestmentRepository investmentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.investmentRepository = investmentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the investment already created with this key, if any
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findInvestmentId(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<UUID> stored = investmentRepository.findByIdempotencyKey(idempotencyKey)
            .map(InvestmentEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeCache(idempotencyKey, id);
        });
        return stored;
    }

    /**
     * Caches the key after the investment row (which carries the key) has been committed.
     */
    public void remember(String idempotencyKey, UUID investmentId) {
        requireKey(idempotencyKey);
        if (investmentId == null) {
            throw new IllegalArgumentException("Investment ID cannot be null");
        }
        writeCache(idempotencyKey, investmentId);
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (DataAccessException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID investmentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, investmentId.toString(), REDIS_TTL);
        } catch (DataAccessException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (idempotencyKey.length() > 255) {
            throw new IllegalArgumentException("Idempotency key must be at most 255 characters");
        }
    }
}
