package com.baselinesentinel.core.detection;

import com.baselinesentinel.core.config.DetectionPolicy;
import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.EntityKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BaselineComparator}.
 */
class BaselineComparatorTest {

    private static final EntityKey ENTITY = EntityKey.of("GET", "orders", "/v1/orders");

    private BaselineComparator comparator;

    @BeforeEach
    void setUp() {
        DetectionPolicy policy = DetectionPolicy.builder()
                .minActivity("A", 100)
                .percentThreshold("A", 30)
                .minActivity("B", 10)
                .percentThreshold("B", 30)
                .build();
        comparator = new BaselineComparator("application", "api_requests", policy);
    }

    @Test
    @DisplayName("Should report growth above threshold rounded to two decimals")
    void shouldReportGrowth() {
        List<AnomalyRecord> records = comparator.compare(measure("A", 14_000), measure("A", 10_000));

        assertThat(records).hasSize(1);
        AnomalyRecord record = records.get(0);
        assertThat(record.getPercentChange()).isEqualTo(40.00);
        assertThat(record.getCurrentValue()).isEqualTo(14_000);
        assertThat(record.getPastValue()).isEqualTo(10_000);
        assertThat(record.getThreshold()).isEqualTo(30);
        assertThat(record.getDomain()).isEqualTo("application");
        assertThat(record.getCheck()).isEqualTo("api_requests");
        assertThat(record.getType()).isEqualTo(AnomalyType.BASELINE_GROWTH);
        assertThat(record.getEntity()).isEqualTo(ENTITY);
        assertThat(record.getMetric()).isEqualTo("A");
    }

    @Test
    @DisplayName("Should skip when the past value is zero")
    void shouldSkipZeroPast() {
        assertThat(comparator.compare(measure("A", 50_000), measure("A", 0))).isEmpty();
    }

    @Test
    @DisplayName("Should skip when current value is at or below the activity floor")
    void shouldApplyActivityFloor() {
        assertThat(comparator.compare(measure("B", 3), measure("B", 1))).isEmpty();
        assertThat(comparator.compare(measure("B", 10), measure("B", 1))).isEmpty();
        assertThat(comparator.compare(measure("B", 11), measure("B", 1))).hasSize(1);
    }

    @Test
    @DisplayName("Should skip entities without a baseline")
    void shouldSkipEntitiesMissingFromPast() {
        Map<EntityKey, Map<String, Double>> past = Map.of(EntityKey.of("other"), Map.of("A", 1.0));

        assertThat(comparator.compare(measure("A", 14_000), past)).isEmpty();
    }

    @Test
    @DisplayName("Should ignore measurements the policy does not cover")
    void shouldIgnoreUncoveredMetrics() {
        assertThat(comparator.compare(measure("C", 14_000), measure("C", 10))).isEmpty();
    }

    @Test
    @DisplayName("Should not report growth equal to the threshold or a decrease")
    void shouldRequireStrictGrowth() {
        assertThat(comparator.compare(measure("A", 13_000), measure("A", 10_000))).isEmpty();
        assertThat(comparator.compare(measure("A", 5_000), measure("A", 10_000))).isEmpty();
    }

    @Test
    @DisplayName("Should produce identical records for identical input")
    void shouldBeIdempotent() {
        Map<EntityKey, Map<String, Double>> current = new LinkedHashMap<>();
        current.put(ENTITY, Map.of("A", 14_000.0, "B", 500.0));
        Map<EntityKey, Map<String, Double>> past = Map.of(ENTITY, Map.of("A", 10_000.0, "B", 100.0));

        assertThat(comparator.compare(current, past))
                .hasSize(2)
                .containsExactlyInAnyOrderElementsOf(comparator.compare(current, past));
    }

    @Test
    @DisplayName("Should match category labels case-insensitively")
    void shouldCanonicaliseCategoryLabels() {
        BaselineComparator meshComparator = new BaselineComparator("application", "mesh",
                DetectionPolicy.builder().percentThreshold("0dc", 10).build());

        assertThat(meshComparator.compare(measure("0DC", 200), measure("0DC", 100))).hasSize(1);
    }

    @Test
    @DisplayName("Should format the severity note with a dot decimal separator under any default locale")
    void shouldFormatNoteIndependentOfLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            AnomalyRecord record = comparator.compare(measure("A", 14_001), measure("A", 10_000)).get(0);

            assertThat(record.getSeverityNote())
                    .isEqualTo("A up 40.01% (10000.00 -> 14001.00, threshold 30.00%)");
        } finally {
            Locale.setDefault(previous);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Map<EntityKey, Map<String, Double>> measure(String metric, double value) {
        return Map.of(ENTITY, Map.of(metric, value));
    }
}
