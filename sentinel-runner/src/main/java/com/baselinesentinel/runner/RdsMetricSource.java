package com.baselinesentinel.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DBClusterMember;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * CloudWatch {@code AWS/RDS} metrics per instance of the configured Aurora
 * clusters. Each instance is labeled {@code writer} or {@code reader}.
 */
public final class RdsMetricSource extends CloudWatchMetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(RdsMetricSource.class);

    static final String NAMESPACE = "AWS/RDS";
    static final String DIMENSION = "DBInstanceIdentifier";
    static final String ROLE_WRITER = "writer";
    static final String ROLE_READER = "reader";

    private final Function<DescribeDbClustersRequest, DescribeDbClustersResponse> describeClusters;
    private final List<String> clusterIds;

    public RdsMetricSource(CloudWatchClient cloudWatch, RdsClient rds, List<String> clusterIds) {
        this(cloudWatch::getMetricStatistics, rds::describeDBClusters, clusterIds);
    }

    RdsMetricSource(Function<GetMetricStatisticsRequest, GetMetricStatisticsResponse> statistics,
            Function<DescribeDbClustersRequest, DescribeDbClustersResponse> describeClusters,
            List<String> clusterIds) {
        super(NAMESPACE, DIMENSION, statistics);
        this.describeClusters = Objects.requireNonNull(describeClusters, "describeClusters must not be null");
        this.clusterIds = List.copyOf(Objects.requireNonNull(clusterIds, "clusterIds must not be null"));
        if (this.clusterIds.isEmpty()) {
            LOG.warn("No RDS cluster identifiers configured; database checks will see no data");
        }
    }

    @Override
    protected List<Member> members() {
        List<Member> members = new ArrayList<>();
        for (String clusterId : clusterIds) {
            DescribeDbClustersResponse response = describeClusters.apply(
                    DescribeDbClustersRequest.builder().dbClusterIdentifier(clusterId).build());
            if (response.dbClusters().isEmpty()) {
                LOG.warn("RDS cluster {} not found", clusterId);
                continue;
            }
            DBCluster cluster = response.dbClusters().get(0);
            List<Member> clusterMembers = new ArrayList<>();
            for (DBClusterMember member : cluster.dbClusterMembers()) {
                String role = Boolean.TRUE.equals(member.isClusterWriter()) ? ROLE_WRITER : ROLE_READER;
                clusterMembers.add(new Member(clusterId, member.dbInstanceIdentifier(), role));
            }
            logTopology(clusterId, clusterMembers, ROLE_READER);
            members.addAll(clusterMembers);
        }
        return members;
    }

    @Override
    public String toString() {
        return "RdsMetricSource{clusterIds=" + clusterIds + '}';
    }
}
