package com.baselinesentinel.core.spi;

/**
 * A metric query could not be completed (network error, timeout, non-2xx
 * response, interrupted call).
 */
public class MetricFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    public MetricFetchException(String message) {
        super(message);
    }

    public MetricFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
