package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.engine.MetricDomain;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.KeyUsage;
import com.baselinesentinel.core.model.TimeWindow;
import com.baselinesentinel.core.model.WindowPair;
import com.baselinesentinel.core.spi.KeyspaceInspector;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricQueryResult;
import com.baselinesentinel.core.spi.MetricSource;
import com.baselinesentinel.core.spi.StubMetricSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OversizedKeyCheck}.
 */
class OversizedKeyCheckTest {

    private static final long MB = 1024L * 1024L;
    private static final Instant NOW = Instant.parse("2024-01-15T06:00:00Z");
    private static final WindowPair WINDOWS = new WindowPair(
            TimeWindow.of(NOW, NOW.plus(Duration.ofHours(1))),
            TimeWindow.of(NOW.minus(Duration.ofDays(7)), NOW.minus(Duration.ofDays(7)).plus(Duration.ofHours(1))));

    @Test
    @DisplayName("Should report keys above the limit largest first with sizes in MB rounded to two decimals")
    void shouldReportOversizedKeys() throws MetricFetchException {
        FakeKeyspace keyspace = new FakeKeyspace(List.of(
                new KeyUsage("cache-0001-001", "session:blob", "string", 12 * MB + MB / 3),
                new KeyUsage("cache-0002-001", "feed:global", "zset", 25 * MB),
                new KeyUsage("cache-0001-001", "exactly:ten", "hash", 10 * MB)));

        List<AnomalyRecord> records = new OversizedKeyCheck(rule(10.0)).run("cache", keyspace, WINDOWS,
                Duration.ofMinutes(10));

        assertThat(keyspace.requestedBytes).containsExactly(10 * MB);
        assertThat(records).extracting(AnomalyRecord::getEntity).containsExactly(
                EntityKey.of("cache-0002-001", "feed:global"),
                EntityKey.of("cache-0001-001", "session:blob"));
        AnomalyRecord first = records.get(0);
        assertThat(first.getType()).isEqualTo(AnomalyType.OVERSIZED_KEY);
        assertThat(first.getMetric()).isEqualTo("zset");
        assertThat(first.getThreshold()).isEqualTo(10.0);
        assertThat(records.get(1).getCurrentValue()).isEqualTo(12.33);
        assertThat(records.get(1).getSeverityNote()).isEqualTo("string key holds 12.33 MB (limit 10.00 MB)");
    }

    @Test
    @DisplayName("Should refuse a domain whose source cannot inspect keys")
    void shouldRejectPlainSource() {
        AnomalyCheck check = new OversizedKeyCheck(rule(10.0));

        assertThatThrownBy(() -> new MetricDomain("cache", List.of(check), new StubMetricSource(),
                Duration.ofMinutes(10)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("redis_bigkeys");
    }

    @Test
    @DisplayName("Should be created by the factory for the bigkeys type")
    void shouldBeCreatedByFactory() {
        assertThat(CheckFactory.create(rule(5.0))).isInstanceOf(OversizedKeyCheck.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static CheckRule rule(double limitMb) {
        CheckRule rule = new CheckRule();
        rule.setName("redis_bigkeys");
        rule.setType(CheckRule.TYPE_BIGKEYS);
        rule.setThreshold(limitMb);
        return rule;
    }

    private static final class FakeKeyspace implements MetricSource, KeyspaceInspector {

        private final List<KeyUsage> keys;
        private final List<Long> requestedBytes = new ArrayList<>();

        FakeKeyspace(List<KeyUsage> keys) {
            this.keys = keys;
        }

        @Override
        public MetricQueryResult queryRange(String query, Instant start, Instant end, Duration step) {
            return MetricQueryResult.empty();
        }

        @Override
        public List<KeyUsage> findKeysLargerThan(long bytes) {
            requestedBytes.add(bytes);
            return keys;
        }
    }
}
