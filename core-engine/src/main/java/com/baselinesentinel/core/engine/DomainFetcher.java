package com.baselinesentinel.core.engine;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.MetricFetchException;

import java.util.List;

/**
 * One domain's fetch, normalize and detect pipeline.
 */
public interface DomainFetcher {

    /**
     * @return domain name, the key of the domain's entry in the report
     */
    String getName();

    /**
     * Run the domain pipeline over one window pair.
     *
     * @param windows current and past window
     * @return the domain's anomalies
     * @throws MetricFetchException if the domain's metrics could not be
     *                              fetched
     */
    List<AnomalyRecord> fetch(WindowPair windows) throws MetricFetchException;
}
