package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.KeyUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Walks the keyspace of one Redis node with {@code SCAN} and measures each
 * key with {@code MEMORY USAGE}.
 *
 * <p>
 * The walk stops after {@code scanLimit} keys so a huge keyspace cannot stall
 * a run. {@code SCAN} may return a key twice; duplicates are dropped.
 * </p>
 */
public final class RedisKeyspaceScanner {

    private static final Logger LOG = LoggerFactory.getLogger(RedisKeyspaceScanner.class);

    static final int SCAN_BATCH = 1000;

    /** The handful of commands the scan needs. */
    interface NodeClient extends AutoCloseable {

        ScanResult<String> scan(String cursor, ScanParams params);

        Long memoryUsage(String key);

        String type(String key);

        @Override
        void close();
    }

    @FunctionalInterface
    interface Connector {
        NodeClient open(String host, int port);
    }

    private final Connector connector;
    private final int scanLimit;

    RedisKeyspaceScanner(Connector connector, int scanLimit) {
        this.connector = Objects.requireNonNull(connector, "connector must not be null");
        if (scanLimit < 1) {
            throw new IllegalArgumentException("scanLimit must be >= 1, got: " + scanLimit);
        }
        this.scanLimit = scanLimit;
    }

    /**
     * Scanner over plain Jedis connections.
     *
     * @param timeoutMillis connect and read timeout
     * @param scanLimit     most keys examined per node
     */
    public static RedisKeyspaceScanner jedis(int timeoutMillis, int scanLimit) {
        return new RedisKeyspaceScanner((host, port) -> new JedisNodeClient(new Jedis(host, port, timeoutMillis)),
                scanLimit);
    }

    /**
     * @param node     node name recorded on each result
     * @param minBytes strict lower bound on key size
     * @return keys above {@code minBytes}, largest first
     * @throws JedisException if the node is unreachable or refuses a command
     */
    public List<KeyUsage> scan(String node, String host, int port, long minBytes) {
        List<KeyUsage> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        ScanParams params = new ScanParams().count(SCAN_BATCH);
        try (NodeClient client = connector.open(host, port)) {
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = client.scan(cursor, params);
                for (String key : page.getResult()) {
                    if (seen.size() >= scanLimit) {
                        break;
                    }
                    if (!seen.add(key)) {
                        continue;
                    }
                    Long bytes = client.memoryUsage(key);
                    if (bytes != null && bytes > minBytes) {
                        found.add(new KeyUsage(node, key, client.type(key), bytes));
                    }
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor) && seen.size() < scanLimit);
            if (seen.size() >= scanLimit) {
                LOG.warn("Stopped scanning {} ({}:{}) after {} keys", node, host, port, scanLimit);
            }
        }
        found.sort(Comparator.comparingLong(KeyUsage::getBytes).reversed());
        LOG.debug("Scanned {} key(s) on {}; {} above {} bytes", seen.size(), node, found.size(), minBytes);
        return found;
    }

    private static final class JedisNodeClient implements NodeClient {
        private final Jedis jedis;

        JedisNodeClient(Jedis jedis) {
            this.jedis = jedis;
        }

        @Override
        public ScanResult<String> scan(String cursor, ScanParams params) {
            return jedis.scan(cursor, params);
        }

        @Override
        public Long memoryUsage(String key) {
            return jedis.memoryUsage(key);
        }

        @Override
        public String type(String key) {
            return jedis.type(key);
        }

        @Override
        public void close() {
            jedis.close();
        }
    }
}
