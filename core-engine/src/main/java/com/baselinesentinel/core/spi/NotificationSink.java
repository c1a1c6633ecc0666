package com.baselinesentinel.core.spi;

import com.baselinesentinel.core.model.AnomalyReport;

/**
 * Destination of non-empty anomaly reports.
 */
public interface NotificationSink {

    /**
     * Publish a report.
     *
     * @param report report with at least one anomaly
     * @throws NotificationException if the report could not be delivered
     */
    void publish(AnomalyReport report);
}
