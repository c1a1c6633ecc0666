package com.baselinesentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckRule} and {@link DomainSettings} validation.
 */
class CheckRuleTest {

    @Test
    @DisplayName("Should accept a complete gauge breach rule")
    void shouldAcceptValidRule() {
        CheckRule rule = rule("pod_memory", "Breach");
        rule.setThreshold(80.0);

        assertThatCode(rule::validate).doesNotThrowAnyException();
        assertThat(rule.getType()).isEqualTo("breach");
        assertThat(rule.metricName()).isEqualTo("pod_memory");
    }

    @Test
    @DisplayName("Should require a threshold for gauge breaches and thresholds for category breaches")
    void shouldRequireThresholds() {
        CheckRule gauge = rule("pod_cpu", "breach");
        CheckRule errors = rule("mesh", "breach");
        errors.setCodeField("response_code");

        assertThatThrownBy(gauge::validate).hasMessageContaining("requires 'threshold'");
        assertThatThrownBy(errors::validate).hasMessageContaining("requires 'thresholds'");
    }

    @Test
    @DisplayName("Should require the metric name in a gauge baseline threshold map")
    void shouldRequireMetricThreshold() {
        CheckRule rule = rule("redis_cpu", "baseline");
        rule.setMetric("cpu");
        rule.setPercentThreshold(Map.of("redis_cpu", 40));

        assertThatThrownBy(rule::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'cpu'");
    }

    @Test
    @DisplayName("Should reject unknown reducers and bucketing modes")
    void shouldRejectUnknownEnums() {
        CheckRule rule = rule("redis_cpu", "baseline");
        rule.setPercentThreshold(Map.of("redis_cpu", 40));
        rule.setReduce("median");
        rule.setBucketing("grpc_code");

        assertThatThrownBy(rule::validate)
                .hasMessageContaining("unknown 'reduce'")
                .hasMessageContaining("Unknown bucketing mode");
    }

    @Test
    @DisplayName("Should report duplicate check names within a domain")
    void shouldRejectDuplicateCheckNames() {
        CheckRule first = rule("cpu", "breach");
        first.setThreshold(1.0);
        CheckRule second = rule("cpu", "breach");
        second.setThreshold(2.0);
        DomainSettings domain = new DomainSettings();
        domain.setName("database");
        domain.setChecks(List.of(first, second));

        assertThat(domain.validate()).singleElement().asString().contains("duplicate check name 'cpu'");
    }

    @Test
    @DisplayName("Should accept a bigkeys rule without query and require a positive size limit")
    void shouldValidateBigkeysRule() {
        CheckRule valid = new CheckRule();
        valid.setName("redis_bigkeys");
        valid.setType(CheckRule.TYPE_BIGKEYS);
        valid.setThreshold(10.0);
        CheckRule missing = new CheckRule();
        missing.setName("redis_bigkeys");
        missing.setType(CheckRule.TYPE_BIGKEYS);
        missing.setThreshold(0.0);

        valid.validate();
        assertThatThrownBy(missing::validate)
                .hasMessageContaining("positive 'threshold'")
                .hasMessageNotContaining("requires 'query'");
    }

    @Test
    @DisplayName("Should default the domain source to prometheus and reject a blank one")
    void shouldValidateDomainSource() {
        CheckRule check = rule("cpu", "breach");
        check.setThreshold(1.0);
        DomainSettings domain = new DomainSettings();
        domain.setName("database");
        domain.setChecks(List.of(check));

        assertThat(domain.getSource()).isEqualTo(DomainSettings.DEFAULT_SOURCE);
        assertThat(domain.validate()).isEmpty();

        domain.setSource(" ");
        assertThat(domain.validate()).singleElement().asString().contains("requires 'source'");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static CheckRule rule(String name, String type) {
        CheckRule rule = new CheckRule();
        rule.setName(name);
        rule.setType(type);
        rule.setQuery("up");
        rule.setKeyFields(List.of("instance"));
        return rule;
    }
}
