package com.flagship.campaign_escrow.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Names and helpers for the logging context of a campaign request.
 *
 * The correlation id travels from the X-Correlation-ID request header into the MDC,
 * from there into every outbox event written during the request, and finally onto
 * the Kafka record as a header. Campaign id and caller are MDC-only.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_HEADER = "X-Caller-Id";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CAMPAIGN_ID_MDC_KEY = "campaignId";
    public static final String CALLER_MDC_KEY = "caller";

    private CorrelationContext() {
    }

    /**
     * Correlation id of the request being served on this thread, if any.
     */
    public static Optional<String> currentCorrelationId() {
        return Optional.ofNullable(MDC.get(CORRELATION_ID_MDC_KEY));
    }

    /**
     * Short random id, readable in logs.
     */
    public static String newCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void clearRequestContext() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(CAMPAIGN_ID_MDC_KEY);
        MDC.remove(CALLER_MDC_KEY);
    }
}
