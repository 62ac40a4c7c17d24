package com.flagship.property_acquisition.saga;

import com.flagship.property_acquisition.exception.AcquisitionException;
import com.flagship.property_acquisition.exception.InternalFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A multi-step write that is made all-or-nothing by compensation instead of a
 * database transaction.
 *
 * Each step is an independent auto-committed write. After a step succeeds its
 * compensating action is pushed on a stack; when a later step fails the stack is
 * unwound in reverse order and the original failure is rethrown.
 *
 * Key principles:
 * - Compensations are conditional writes themselves, so running one against a row
 *   that moved on in the meantime is a harmless no-op
 * - A failing compensation never masks the original failure; it is logged at ERROR
 *   and attached to it as a suppressed exception
 * - Typed acquisition failures propagate unchanged, anything else is wrapped as an
 *   internal failure
 *
 * Instances are single-use and not thread-safe.
 */
@Slf4j
public class Saga {

    private final String name;
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    private final CompensationListener listener;
    private boolean compensated;

    public Saga(String name) {
        this(name, CompensationListener.NONE);
    }

    public Saga(String name, CompensationListener listener) {
        this.name = name;
        this.listener = listener;
    }

    /**
     * Runs a step. On success the compensation (if any) is registered with the step's result.
     * On failure every previously registered compensation runs, newest first.
     */
    public <T> T execute(String stepName, Supplier<T> action, Consumer<T> compensation) {
        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            log.warn("Saga {} failed at step {}: {}", name, stepName, e.getMessage());
            throw compensate(e);
        }
        if (compensation != null) {
            compensations.push(new Compensation(stepName, () -> compensation.accept(result)));
        }
        return result;
    }

    /**
     * Runs a step with no result.
     */
    public void run(String stepName, Runnable action, Runnable compensation) {
        Consumer<Object> undo = compensation == null ? null : ignored -> compensation.run();
        this.<Object>execute(stepName, () -> {
            action.run();
            return null;
        }, undo);
    }

    /**
     * Registers a compensation for a write that was done outside {@link #execute}.
     */
    public void onRollback(String stepName, Runnable compensation) {
        compensations.push(new Compensation(stepName, compensation));
    }

    /**
     * Unwinds every registered compensation because of {@code cause} and returns the
     * exception the caller should throw.
     */
    public AcquisitionException compensate(RuntimeException cause) {
        AcquisitionException failure = cause instanceof AcquisitionException acquisitionException
                ? acquisitionException
                : new InternalFailureException("Operation " + name + " failed", cause);
        rollback(failure);
        return failure;
    }

    /**
     * Unwinds every registered compensation without an underlying exception, for
     * callers that detect a lost race and want to back out cleanly.
     */
    public void rollback() {
        rollback(null);
    }

    /**
     * Drops every registered compensation without running it, for when the writes done
     * so far are now relied upon by a concurrent operation that won.
     */
    public void forget() {
        compensations.clear();
    }

    public boolean isCompensated() {
        return compensated;
    }

    private void rollback(Throwable failure) {
        if (compensations.isEmpty()) {
            return;
        }
        compensated = true;
        listener.onCompensation(name);
        while (!compensations.isEmpty()) {
            Compensation compensation = compensations.pop();
            try {
                compensation.action().run();
                log.info("Saga {} compensated step {}", name, compensation.stepName());
            } catch (RuntimeException e) {
                log.error("Saga {} failed to compensate step {}", name, compensation.stepName(), e);
                listener.onCompensationFailure(name, compensation.stepName());
                if (failure != null) {
                    failure.addSuppressed(e);
                }
            }
        }
    }

    private record Compensation(String stepName, Runnable action) {}

    /**
     * Hook for recording compensations (metrics).
     */
    public interface CompensationListener {

        CompensationListener NONE = new CompensationListener() {
        };

        default void onCompensation(String sagaName) {
        }

        default void onCompensationFailure(String sagaName, String stepName) {
        }
    }
}
