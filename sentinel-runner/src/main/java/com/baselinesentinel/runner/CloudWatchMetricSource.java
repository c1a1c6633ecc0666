package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.LabeledSeries;
import com.baselinesentinel.core.model.RawSeriesPoint;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricQueryResult;
import com.baselinesentinel.core.spi.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link MetricSource} over CloudWatch {@code GetMetricStatistics} for the
 * members of managed clusters.
 *
 * <p>
 * A query is a metric name with an optional statistic,
 * {@code MetricName[:Statistic]}, e.g. {@code CPUUtilization} or
 * {@code DatabaseConnections:Maximum}. The statistic defaults to
 * {@code Average}. Members are discovered on every call; each one becomes a
 * series labeled {@code cluster}, {@code instance} and {@code role}.
 * </p>
 *
 * <p>
 * An unknown statistic is answered with status {@code error}, which the
 * checks treat as no data. SDK failures raise {@link MetricFetchException}.
 * </p>
 */
public abstract class CloudWatchMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(CloudWatchMetricSource.class);

    static final String LABEL_CLUSTER = "cluster";
    static final String LABEL_INSTANCE = "instance";
    static final String LABEL_ROLE = "role";

    /** Standard-resolution metrics are aggregated in whole minutes. */
    private static final long MIN_PERIOD_SECONDS = 60;

    private final String namespace;
    private final String dimensionName;
    private final Function<GetMetricStatisticsRequest, GetMetricStatisticsResponse> statistics;

    protected CloudWatchMetricSource(String namespace, String dimensionName,
            Function<GetMetricStatisticsRequest, GetMetricStatisticsResponse> statistics) {
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.dimensionName = Objects.requireNonNull(dimensionName, "dimensionName must not be null");
        this.statistics = Objects.requireNonNull(statistics, "statistics call must not be null");
    }

    /**
     * One monitored instance of a cluster.
     */
    protected static final class Member {
        private final String cluster;
        private final String instance;
        private final String role;

        protected Member(String cluster, String instance, String role) {
            this.cluster = Objects.requireNonNull(cluster, "cluster must not be null");
            this.instance = Objects.requireNonNull(instance, "instance must not be null");
            this.role = Objects.requireNonNull(role, "role must not be null");
        }

        public String getCluster() {
            return cluster;
        }

        public String getInstance() {
            return instance;
        }

        public String getRole() {
            return role;
        }

        @Override
        public String toString() {
            return cluster + "/" + instance + " (" + role + ")";
        }
    }

    /**
     * Discover the instances to query.
     *
     * @throws SdkException if the discovery call fails
     */
    protected abstract List<Member> members();

    @Override
    public MetricQueryResult queryRange(String query, Instant start, Instant end, Duration step)
            throws MetricFetchException {
        Objects.requireNonNull(query, "query must not be null");
        int colon = query.indexOf(':');
        String metricName = (colon < 0 ? query : query.substring(0, colon)).trim();
        Statistic statistic = colon < 0 ? Statistic.AVERAGE : Statistic.fromValue(query.substring(colon + 1).trim());
        if (metricName.isEmpty() || statistic == Statistic.UNKNOWN_TO_SDK_VERSION) {
            LOG.warn("Unsupported CloudWatch query '{}'; expected MetricName[:Statistic]", query);
            return new MetricQueryResult("error", null);
        }

        int period = (int) Math.max(MIN_PERIOD_SECONDS, step.getSeconds() / MIN_PERIOD_SECONDS * MIN_PERIOD_SECONDS);
        try {
            List<LabeledSeries> series = new ArrayList<>();
            for (Member member : members()) {
                GetMetricStatisticsResponse response = statistics.apply(GetMetricStatisticsRequest.builder()
                        .namespace(namespace)
                        .metricName(metricName)
                        .dimensions(Dimension.builder().name(dimensionName).value(member.getInstance()).build())
                        .startTime(start)
                        .endTime(end)
                        .period(period)
                        .statistics(statistic)
                        .build());
                series.add(new LabeledSeries(labels(member), points(response.datapoints(), statistic)));
            }
            LOG.debug("{} {} {}: {} series for {} -> {}", namespace, metricName, statistic, series.size(), start, end);
            return MetricQueryResult.success(series);
        } catch (SdkException e) {
            throw new MetricFetchException(namespace + " query for " + metricName + " failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, String> labels(Member member) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_CLUSTER, member.getCluster());
        labels.put(LABEL_INSTANCE, member.getInstance());
        labels.put(LABEL_ROLE, member.getRole());
        return labels;
    }

    // CloudWatch does not order datapoints
    private static List<RawSeriesPoint> points(List<Datapoint> datapoints, Statistic statistic) {
        List<Datapoint> sorted = new ArrayList<>(datapoints);
        sorted.sort(Comparator.comparing(Datapoint::timestamp,
                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
        List<RawSeriesPoint> points = new ArrayList<>(sorted.size());
        for (Datapoint datapoint : sorted) {
            Double value = valueOf(datapoint, statistic);
            if (datapoint.timestamp() == null || value == null || !Double.isFinite(value)) {
                continue;
            }
            points.add(new RawSeriesPoint(datapoint.timestamp(), value));
        }
        return points;
    }

    private static Double valueOf(Datapoint datapoint, Statistic statistic) {
        return switch (statistic) {
            case MAXIMUM -> datapoint.maximum();
            case MINIMUM -> datapoint.minimum();
            case SUM -> datapoint.sum();
            case SAMPLE_COUNT -> datapoint.sampleCount();
            default -> datapoint.average();
        };
    }

    protected static void logTopology(String cluster, List<Member> members, String replicaRole) {
        long replicas = members.stream().filter(m -> m.getRole().equals(replicaRole)).count();
        LOG.debug("Cluster {}: {} member(s), {} replica(s)", cluster, members.size(), replicas);
    }
}
