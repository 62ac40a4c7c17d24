package com.flagship.property_acquisition.observability;

import com.flagship.property_acquisition.saga.Saga;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for acquisition operations.
 *
 * Metrics exposed:
 * - acquisition.transitions: Counter of successful interest transitions, tagged by target status
 * - acquisition.conflicts: Counter of lost conditional writes, tagged by operation
 * - acquisition.compensations: Counter of sagas that had to unwind, tagged by saga
 * - acquisition.compensation.failures: Counter of compensating writes that themselves failed
 * - acquisition.handover.started: Counter of handover starts, tagged by outcome
 * - acquisition.deposit.references: Counter of payment reference lookups (hit/miss)
 * - acquisition.handover.duration: Timer for the handover saga
 */
@Component
public class AcquisitionMetrics implements Saga.CompensationListener {

    private final MeterRegistry registry;

    private final Timer handoverTimer;

    public AcquisitionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.handoverTimer = Timer.builder("acquisition.handover.duration")
                .description("Time taken to run the handover saga")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordTransition(String toStatus) {
        registry.counter("acquisition.transitions", "to", sanitizeTag(toStatus)).increment();
    }

    public void recordConflict(String operation) {
        registry.counter("acquisition.conflicts", "operation", sanitizeTag(operation)).increment();
    }

    public void recordHandoverOutcome(String outcome) {
        registry.counter("acquisition.handover.started", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReferenceHit() {
        registry.counter("acquisition.deposit.references", "result", "hit").increment();
    }

    public void recordReferenceMiss() {
        registry.counter("acquisition.deposit.references", "result", "miss").increment();
    }

    public <T> T timeHandover(Supplier<T> operation) {
        return handoverTimer.record(operation);
    }

    @Override
    public void onCompensation(String sagaName) {
        Counter.builder("acquisition.compensations")
                .tag("saga", sanitizeTag(sagaName))
                .register(registry)
                .increment();
    }

    @Override
    public void onCompensationFailure(String sagaName, String stepName) {
        Counter.builder("acquisition.compensation.failures")
                .tag("saga", sanitizeTag(sagaName))
                .tag("step", sanitizeTag(stepName))
                .register(registry)
                .increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
