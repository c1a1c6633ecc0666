package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.KeyUsage;
import com.baselinesentinel.core.spi.KeyspaceInspector;
import com.baselinesentinel.core.spi.MetricFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.exceptions.JedisException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.elasticache.ElastiCacheClient;
import software.amazon.awssdk.services.elasticache.model.CacheCluster;
import software.amazon.awssdk.services.elasticache.model.CacheNode;
import software.amazon.awssdk.services.elasticache.model.DescribeCacheClustersRequest;
import software.amazon.awssdk.services.elasticache.model.DescribeCacheClustersResponse;
import software.amazon.awssdk.services.elasticache.model.DescribeReplicationGroupsRequest;
import software.amazon.awssdk.services.elasticache.model.DescribeReplicationGroupsResponse;
import software.amazon.awssdk.services.elasticache.model.Endpoint;
import software.amazon.awssdk.services.elasticache.model.NodeGroup;
import software.amazon.awssdk.services.elasticache.model.NodeGroupMember;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * CloudWatch {@code AWS/ElastiCache} metrics per node of the configured Redis
 * replication groups, plus a big-key scan of their primaries.
 *
 * <p>
 * A node's role comes from ElastiCache when it reports one; otherwise the
 * first member of each node group is taken as the primary. Endpoints come
 * from the node's cache cluster, falling back to the member's read endpoint
 * and port {@value #DEFAULT_PORT}.
 * </p>
 */
public final class ElastiCacheMetricSource extends CloudWatchMetricSource implements KeyspaceInspector {

    private static final Logger LOG = LoggerFactory.getLogger(ElastiCacheMetricSource.class);

    static final String NAMESPACE = "AWS/ElastiCache";
    static final String DIMENSION = "CacheClusterId";
    static final String ROLE_PRIMARY = "primary";
    static final String ROLE_REPLICA = "replica";
    static final int DEFAULT_PORT = 6379;

    private final Function<DescribeReplicationGroupsRequest, DescribeReplicationGroupsResponse> describeGroups;
    private final Function<DescribeCacheClustersRequest, DescribeCacheClustersResponse> describeClusters;
    private final List<String> replicationGroupIds;
    private final RedisKeyspaceScanner scanner;

    public ElastiCacheMetricSource(CloudWatchClient cloudWatch, ElastiCacheClient elastiCache,
            List<String> replicationGroupIds, RedisKeyspaceScanner scanner) {
        this(cloudWatch::getMetricStatistics, elastiCache::describeReplicationGroups,
                elastiCache::describeCacheClusters, replicationGroupIds, scanner);
    }

    ElastiCacheMetricSource(Function<GetMetricStatisticsRequest, GetMetricStatisticsResponse> statistics,
            Function<DescribeReplicationGroupsRequest, DescribeReplicationGroupsResponse> describeGroups,
            Function<DescribeCacheClustersRequest, DescribeCacheClustersResponse> describeClusters,
            List<String> replicationGroupIds, RedisKeyspaceScanner scanner) {
        super(NAMESPACE, DIMENSION, statistics);
        this.describeGroups = Objects.requireNonNull(describeGroups, "describeGroups must not be null");
        this.describeClusters = Objects.requireNonNull(describeClusters, "describeClusters must not be null");
        this.replicationGroupIds = List.copyOf(
                Objects.requireNonNull(replicationGroupIds, "replicationGroupIds must not be null"));
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        if (this.replicationGroupIds.isEmpty()) {
            LOG.warn("No ElastiCache replication groups configured; cache checks will see no data");
        }
    }

    @Override
    protected List<Member> members() {
        List<Member> members = new ArrayList<>();
        for (String groupId : replicationGroupIds) {
            List<Member> groupMembers = discover(groupId).stream().map(Node::member).toList();
            logTopology(groupId, groupMembers, ROLE_REPLICA);
            members.addAll(groupMembers);
        }
        return members;
    }

    @Override
    public List<KeyUsage> findKeysLargerThan(long bytes) throws MetricFetchException {
        List<Node> primaries = new ArrayList<>();
        List<Endpoint> endpoints = new ArrayList<>();
        try {
            for (String groupId : replicationGroupIds) {
                for (Node node : discover(groupId)) {
                    if (ROLE_PRIMARY.equals(node.member().getRole())) {
                        primaries.add(node);
                        endpoints.add(endpointOf(node.raw()));
                    }
                }
            }
        } catch (SdkException e) {
            throw new MetricFetchException("ElastiCache discovery failed: " + e.getMessage(), e);
        }

        List<KeyUsage> found = new ArrayList<>();
        for (int i = 0; i < primaries.size(); i++) {
            Member primary = primaries.get(i).member();
            Endpoint endpoint = endpoints.get(i);
            if (endpoint.address() == null) {
                LOG.warn("No endpoint known for {}; skipping key scan", primary);
                continue;
            }
            int port = endpoint.port() != null ? endpoint.port() : DEFAULT_PORT;
            try {
                found.addAll(scanner.scan(primary.getInstance(), endpoint.address(), port, bytes));
            } catch (JedisException e) {
                LOG.warn("Key scan of {} at {}:{} failed: {}", primary, endpoint.address(), port, e.getMessage());
            }
        }
        found.sort(Comparator.comparingLong(KeyUsage::getBytes).reversed());
        return found;
    }

    // ---------------------------------------------------------------
    // Discovery
    // ---------------------------------------------------------------

    private static final class Node {
        private final Member member;
        private final NodeGroupMember raw;

        Node(Member member, NodeGroupMember raw) {
            this.member = member;
            this.raw = raw;
        }

        Member member() {
            return member;
        }

        NodeGroupMember raw() {
            return raw;
        }
    }

    private List<Node> discover(String groupId) {
        DescribeReplicationGroupsResponse response = describeGroups.apply(
                DescribeReplicationGroupsRequest.builder().replicationGroupId(groupId).build());
        if (response.replicationGroups().isEmpty()) {
            LOG.warn("ElastiCache replication group {} not found", groupId);
            return List.of();
        }
        List<Node> nodes = new ArrayList<>();
        for (NodeGroup nodeGroup : response.replicationGroups().get(0).nodeGroups()) {
            List<NodeGroupMember> shard = nodeGroup.nodeGroupMembers();
            for (int i = 0; i < shard.size(); i++) {
                NodeGroupMember member = shard.get(i);
                nodes.add(new Node(new Member(groupId, member.cacheClusterId(), roleOf(member, i == 0)), member));
            }
        }
        return nodes;
    }

    private static String roleOf(NodeGroupMember member, boolean firstOfShard) {
        String reported = member.currentRole();
        if (reported != null && !reported.isBlank()) {
            return reported.toLowerCase(Locale.ROOT);
        }
        return firstOfShard ? ROLE_PRIMARY : ROLE_REPLICA;
    }

    private Endpoint endpointOf(NodeGroupMember member) {
        DescribeCacheClustersResponse response = describeClusters.apply(DescribeCacheClustersRequest.builder()
                .cacheClusterId(member.cacheClusterId())
                .showCacheNodeInfo(true)
                .build());
        for (CacheCluster cluster : response.cacheClusters()) {
            for (CacheNode node : cluster.cacheNodes()) {
                if (node.endpoint() != null && node.endpoint().address() != null) {
                    return node.endpoint();
                }
            }
        }
        Endpoint read = member.readEndpoint();
        return read != null ? read : Endpoint.builder().build();
    }

    @Override
    public String toString() {
        return "ElastiCacheMetricSource{replicationGroupIds=" + replicationGroupIds + '}';
    }
}
