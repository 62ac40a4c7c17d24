package com.flagship.property_acquisition.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation and per-operation log keys.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - Outbox events (in the payload)
 * - All log statements (via MDC)
 *
 * Acquisition operations additionally bind the property and client they act on,
 * see {@link #bind(UUID, UUID)}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PROPERTY_ID_MDC_KEY = "propertyId";
    public static final String CLIENT_ID_MDC_KEY = "clientId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Puts the property and client of the current operation into the MDC until the
     * returned scope is closed. Keys already present (an outer operation) are restored.
     */
    public static LogScope bind(UUID propertyId, UUID clientId) {
        return new LogScope(propertyId, clientId);
    }

    public static final class LogScope implements AutoCloseable {

        private final String previousProperty;
        private final String previousClient;

        private LogScope(UUID propertyId, UUID clientId) {
            this.previousProperty = MDC.get(PROPERTY_ID_MDC_KEY);
            this.previousClient = MDC.get(CLIENT_ID_MDC_KEY);
            put(PROPERTY_ID_MDC_KEY, propertyId != null ? propertyId.toString() : null);
            put(CLIENT_ID_MDC_KEY, clientId != null ? clientId.toString() : null);
        }

        @Override
        public void close() {
            put(PROPERTY_ID_MDC_KEY, previousProperty);
            put(CLIENT_ID_MDC_KEY, previousClient);
        }

        private static void put(String key, String value) {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        }
    }
}
