package com.flagship.pos_core.payment;

import com.flagship.pos_core.observability.SaleMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Payment idempotency keys: Redis fast path, database as the source of truth.
 *
 * Keys belong to a business: the same key used by two businesses names two
 * unrelated payments. A Redis hit is confirmed against the database before
 * it is trusted, and keys are cached only after the booking transaction
 * commits, so a rolled back payment never leaves a key behind.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "pos:idempotency:payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final SaleMetrics saleMetrics;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              SaleMetrics saleMetrics) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
        this.saleMetrics = saleMetrics;
    }

    /**
     * @return the payment previously booked under this key
     */
    public Optional<PaymentEntity> findExisting(UUID businessId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }

        Optional<PaymentEntity> cached = lookupRedis(businessId, idempotencyKey)
            .flatMap(paymentRepository::findById)
            .filter(payment -> payment.getBusinessId().equals(businessId));
        if (cached.isPresent()) {
            saleMetrics.recordIdempotencyHit();
            return cached;
        }

        Optional<PaymentEntity> stored = findStored(businessId, idempotencyKey);
        if (stored.isPresent()) {
            saleMetrics.recordIdempotencyHit();
            cache(businessId, idempotencyKey, stored.get().getId());
        } else {
            saleMetrics.recordIdempotencyMiss();
        }
        return stored;
    }

    /**
     * Database-only lookup, for use once the sale row is locked. Sees payments
     * committed by a concurrent retry that held the lock first.
     */
    public Optional<PaymentEntity> findStored(UUID businessId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Optional.empty();
        }
        return paymentRepository.findByBusinessIdAndIdempotencyKey(businessId, idempotencyKey);
    }

    /**
     * Caches the key once the surrounding transaction commits.
     */
    public void rememberAfterCommit(UUID businessId, String idempotencyKey, UUID paymentId) {
        if (idempotencyKey == null || idempotencyKey.isBlank() || redisTemplate.isEmpty()) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(businessId, idempotencyKey, paymentId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(businessId, idempotencyKey, paymentId);
            }
        });
    }

    private static String redisKey(UUID businessId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + businessId + ":" + idempotencyKey;
    }

    private Optional<UUID> lookupRedis(UUID businessId, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(redisKey(businessId, idempotencyKey));
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void cache(UUID businessId, String idempotencyKey, UUID paymentId) {
        try {
            redisTemplate.ifPresent(redis ->
                redis.opsForValue().set(redisKey(businessId, idempotencyKey), paymentId.toString(), REDIS_TTL));
        } catch (RuntimeException e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }
}
