package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyReport;
import com.baselinesentinel.core.model.DeploymentRecord;
import com.baselinesentinel.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@link NotificationSink} that writes a readable summary plus the JSON
 * document to the application log.
 */
public final class LoggingReportSink implements NotificationSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingReportSink.class);

    @Override
    public void publish(AnomalyReport report) {
        LOG.warn("{}", summarize(report));
        LOG.info("Anomaly report: {}", ReportSerializer.toJson(report));
    }

    /**
     * Multi-line, human-readable digest of a report.
     */
    static String summarize(AnomalyReport report) {
        StringBuilder sb = new StringBuilder()
                .append(report.totalAnomalies()).append(" anomaly(ies) in current window ")
                .append(report.getWindow().getCurrent())
                .append(" compared with ").append(report.getWindow().getPast());
        for (Map.Entry<String, List<AnomalyRecord>> entry : report.getByDomain().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            sb.append("\n[").append(entry.getKey()).append(']');
            for (AnomalyRecord r : entry.getValue()) {
                sb.append("\n  ").append(r.getType()).append(' ')
                        .append(r.getEntity().display()).append(' ').append(r.getMetric())
                        .append(" current=").append(r.getCurrentValue());
                if (r.getPercentChange() != null) {
                    sb.append(" past=").append(r.getPastValue())
                            .append(" change=").append(r.getPercentChange()).append('%');
                } else {
                    sb.append(" indices=").append(r.getBreachIndices());
                }
                sb.append(" threshold=").append(r.getThreshold());
            }
        }
        if (!report.getDeployments().isEmpty()) {
            sb.append("\nRecent deployments:");
            for (DeploymentRecord d : report.getDeployments()) {
                sb.append("\n  ").append(d.getNamespace()).append('/').append(d.getName())
                        .append(" created=").append(d.getCreatedAt())
                        .append(" available=").append(d.getAvailableReplicas());
            }
        }
        return sb.toString();
    }
}
