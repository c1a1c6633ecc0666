package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricSource;

import java.time.Duration;
import java.util.List;

/**
 * Contract for one configured check of a metric domain: fetch, normalize and
 * detect.
 * <p>
 * Implementations are <strong>stateless</strong> between runs and may be
 * shared by concurrent invocations.
 * </p>
 */
public interface AnomalyCheck {

    /**
     * Run the check over one window pair.
     *
     * @param domain  domain name stamped on every record
     * @param source  metric source to query
     * @param windows current and past window
     * @param step    query resolution
     * @return anomalies found, empty when the data shows none or there is no
     *         data
     * @throws MetricFetchException if a query could not be completed
     */
    List<AnomalyRecord> run(String domain, MetricSource source, WindowPair windows, Duration step)
            throws MetricFetchException;

    /**
     * Return the unique name of this check within its domain.
     *
     * @return check name
     */
    String getName();

    /**
     * Reject a source this check cannot work with. Called once when the
     * domain is built.
     *
     * @param source the domain's metric source
     * @throws IllegalArgumentException if the source lacks a capability the
     *                                  check needs
     */
    default void verifySource(MetricSource source) {
    }
}
