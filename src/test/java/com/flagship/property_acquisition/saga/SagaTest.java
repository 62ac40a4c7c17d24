package com.flagship.property_acquisition.saga;

import com.flagship.property_acquisition.exception.AcquisitionException;
import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.InternalFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SagaTest {

    @Test
    @DisplayName("Compensations run newest first when a later step fails")
    void compensatesInReverseOrder() {
        List<String> undone = new ArrayList<>();
        Saga saga = new Saga("test");

        saga.run("a", () -> { }, () -> undone.add("a"));
        saga.execute("b", () -> 42, value -> undone.add("b:" + value));

        ConflictException failure = assertThrows(ConflictException.class,
                () -> saga.run("c", () -> { throw new ConflictException("lost"); }, () -> undone.add("c")));

        assertEquals("lost", failure.getMessage());
        assertEquals(List.of("b:42", "a"), undone);
        assertTrue(saga.isCompensated());
    }

    @Test
    @DisplayName("Untyped failures are wrapped as internal failures")
    void wrapsUnexpectedFailures() {
        Saga saga = new Saga("test");
        IllegalStateException cause = new IllegalStateException("db gone");

        AcquisitionException failure = assertThrows(AcquisitionException.class,
                () -> saga.run("a", () -> { throw cause; }, null));

        assertInstanceOf(InternalFailureException.class, failure);
        assertSame(cause, failure.getCause());
        assertEquals(AcquisitionException.ErrorCategory.INTERNAL, failure.getCategory());
    }

    @Test
    @DisplayName("A failing compensation is attached as suppressed and the rest still run")
    void compensationFailureIsSuppressed() {
        List<String> undone = new ArrayList<>();
        List<String> failedSteps = new ArrayList<>();
        Saga saga = new Saga("test", new Saga.CompensationListener() {
            @Override
            public void onCompensationFailure(String sagaName, String stepName) {
                failedSteps.add(stepName);
            }
        });

        saga.run("a", () -> { }, () -> undone.add("a"));
        saga.run("b", () -> { }, () -> { throw new IllegalStateException("undo failed"); });

        ConflictException failure = assertThrows(ConflictException.class,
                () -> saga.run("c", () -> { throw new ConflictException("lost"); }, null));

        assertEquals(List.of("a"), undone);
        assertEquals(List.of("b"), failedSteps);
        assertEquals(1, failure.getSuppressed().length);
        assertEquals("undo failed", failure.getSuppressed()[0].getMessage());
    }

    @Test
    @DisplayName("forget drops compensations without running them")
    void forgetDropsCompensations() {
        List<String> undone = new ArrayList<>();
        Saga saga = new Saga("test");
        saga.onRollback("a", () -> undone.add("a"));

        saga.forget();
        saga.rollback();

        assertTrue(undone.isEmpty());
        assertFalse(saga.isCompensated());
    }

    @Test
    @DisplayName("Explicit rollback unwinds registered compensations")
    void explicitRollback() {
        List<String> undone = new ArrayList<>();
        Saga saga = new Saga("test");
        saga.onRollback("a", () -> undone.add("a"));
        saga.onRollback("b", () -> undone.add("b"));

        saga.rollback();

        assertEquals(List.of("b", "a"), undone);
        assertTrue(saga.isCompensated());
    }
}
