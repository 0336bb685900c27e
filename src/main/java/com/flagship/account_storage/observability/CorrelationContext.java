package com.flagship.account_storage.observability;

import java.util.UUID;

/**
 * Header and MDC keys used to correlate log lines of one request and one ledger transaction.
 *
 * The correlation id flows from the HTTP request header into MDC. Each contract invocation
 * adds the ledger transaction id and the function name for its duration.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TX_ID_MDC_KEY = "txId";
    public static final String FUNCTION_MDC_KEY = "function";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Returns {@code supplied} when present, otherwise a new short id.
     */
    public static String resolveCorrelationId(String supplied) {
        if (supplied != null && !supplied.isBlank()) {
            return supplied;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
