package com.flagship.property_acquisition.payment;

import com.flagship.property_acquisition.observability.AcquisitionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers which installment a payment reference produced, so a repeated deposit
 * submission returns the original installment instead of charging twice.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the installments table, whose unique reference column is the
 *    source of truth
 * 3. Re-cache database hits in Redis
 */
@Service
@Slf4j
public class DepositReferenceRegistry {

    private static final String REDIS_KEY_PREFIX = "deposit-ref:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final InstallmentStore installmentStore;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final AcquisitionMetrics metrics;

    public DepositReferenceRegistry(InstallmentStore installmentStore,
                                    Optional<StringRedisTemplate> redisTemplate,
                                    AcquisitionMetrics metrics) {
        this.installmentStore = installmentStore;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return the installment previously recorded for this reference, if any
     */
    public Optional<PaymentInstallment> lookup(String paymentReference) {
        Optional<UUID> cached = readCache(paymentReference);
        if (cached.isPresent()) {
            Optional<PaymentInstallment> installment = installmentStore.findById(cached.get());
            if (installment.isPresent()) {
                metrics.recordReferenceHit();
                return installment;
            }
            log.debug("Stale cache entry for payment reference {}", paymentReference);
        }

        Optional<PaymentInstallment> stored = installmentStore.findByReference(paymentReference);
        if (stored.isPresent()) {
            metrics.recordReferenceHit();
            remember(paymentReference, stored.get().getId());
        } else {
            metrics.recordReferenceMiss();
        }
        return stored;
    }

    /**
     * Caches the mapping. Best effort: the database row already guarantees uniqueness.
     */
    public void remember(String paymentReference, UUID installmentId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + paymentReference, installmentId.toString(), REDIS_TTL);
            } catch (Exception e) {
                log.warn("Failed to cache payment reference {} in Redis: {}", paymentReference, e.getMessage());
            }
        });
    }

    private Optional<UUID> readCache(String paymentReference) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + paymentReference);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for payment reference {}, falling back to database: {}",
                    paymentReference, e.getMessage());
            return Optional.empty();
        }
    }
}
