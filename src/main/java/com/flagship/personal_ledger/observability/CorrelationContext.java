package com.flagship.personal_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the ledger.
 *
 * The id comes from the X-Correlation-ID request header or is generated, and
 * appears in every log line of the request through MDC.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String OWNER_ID_MDC_KEY = "ownerId";
    public static final String TEMPLATE_ID_MDC_KEY = "templateId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Current correlation id; generated on first access when none was set.
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
     * Short form, easier to read in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
