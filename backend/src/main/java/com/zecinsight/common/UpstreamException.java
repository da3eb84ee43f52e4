package com.zecinsight.common;

/**
 * Payment Gateway or indexer data unavailable. Retryable; the API reduces it to a generic "try again" message.
 */
public class UpstreamException extends InsightException {

    public static final String CODE = "UPSTREAM_UNAVAILABLE";

    public UpstreamException(String message) {
        super(CODE, 502, message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(CODE, 502, message, cause);
    }
}
