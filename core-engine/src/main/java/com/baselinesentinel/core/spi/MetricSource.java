package com.baselinesentinel.core.spi;

import java.time.Duration;
import java.time.Instant;

/**
 * Range-query endpoint of one metric backend. Domains pick their source by
 * name, so a PromQL server and a cloud metrics API can serve the same run.
 *
 * <p>
 * Implementations must be safe for concurrent use: domains of one run are
 * fetched in parallel.
 * </p>
 */
public interface MetricSource {

    /**
     * Evaluate {@code query} over {@code [start, end]} at resolution
     * {@code step}.
     *
     * @param query expression in the backend's own query syntax
     * @param start range start (UTC)
     * @param end   range end (UTC)
     * @param step  query resolution
     * @return the response; a non-success status or missing series means "no
     *         data", never an error
     * @throws MetricFetchException on transport failure, timeout or a
     *                              rejected call
     */
    MetricQueryResult queryRange(String query, Instant start, Instant end, Duration step)
            throws MetricFetchException;
}
