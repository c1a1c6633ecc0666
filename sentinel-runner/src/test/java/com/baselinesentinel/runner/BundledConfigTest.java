package com.baselinesentinel.runner;

import com.baselinesentinel.core.config.CheckRule;
import com.baselinesentinel.core.config.ConfigLoader;
import com.baselinesentinel.core.config.DomainSettings;
import com.baselinesentinel.core.config.SentinelConfig;
import com.baselinesentinel.core.detection.CheckFactory;
import com.baselinesentinel.core.spi.KeyspaceInspector;
import com.baselinesentinel.core.spi.MetricSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Verifies the {@code sentinel.yml} shipped with the runner.
 */
class BundledConfigTest {

    @Test
    @DisplayName("Should parse, validate and build every check of the bundled configuration")
    void bundledConfigIsUsable() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.enabledDomains())
                .extracting(DomainSettings::getName)
                .containsExactly("application", "database", "cache");
        for (DomainSettings domain : config.enabledDomains()) {
            assertThatCode(() -> CheckFactory.createAll(domain.getChecks())).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("Should read database and cache metrics from their AWS sources")
    void awsDomainsUseTheirSources() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.enabledDomains())
                .extracting(DomainSettings::getSource)
                .containsExactly(BaselineSentinelApp.SOURCE_PROMETHEUS, BaselineSentinelApp.SOURCE_RDS,
                        BaselineSentinelApp.SOURCE_ELASTICACHE);
        assertThat(config.enabledDomains().get(2).getChecks())
                .extracting(CheckRule::getType)
                .contains(CheckRule.TYPE_BIGKEYS);
    }

    @Test
    @DisplayName("Should exclude the /v2/ and /ui/ handlers from API request counts")
    void apiRequestsExcludeLegacyHandlers() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        CheckRule apiRequests = config.getDomains().get(0).getChecks().stream()
                .filter(rule -> rule.getName().equals("api_requests"))
                .findFirst()
                .orElseThrow();

        assertThat(apiRequests.getQuery())
                .startsWith("sum(increase(http_request_duration_seconds_count{")
                .contains("handler!~\"/v2/.*|/ui/.*\"");
    }

    @Test
    @DisplayName("Should build one metric source per source name the domains use")
    void buildsSourcesForDomains() throws Exception {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);
        List<AutoCloseable> resources = new ArrayList<>();
        try {
            Map<String, MetricSource> sources = BaselineSentinelApp.sources(
                    RunnerConfig.fromEnvironment(Map.of("AWS_REGION", "eu-west-1")), config, resources);

            assertThat(sources).containsOnlyKeys(BaselineSentinelApp.SOURCE_PROMETHEUS,
                    BaselineSentinelApp.SOURCE_RDS, BaselineSentinelApp.SOURCE_ELASTICACHE);
            assertThat(sources.get(BaselineSentinelApp.SOURCE_ELASTICACHE)).isInstanceOf(KeyspaceInspector.class);
            assertThat(resources).hasSize(3);
        } finally {
            for (AutoCloseable resource : resources) {
                resource.close();
            }
        }
    }

    @Test
    @DisplayName("Should not create AWS clients when every domain reads Prometheus")
    void prometheusOnlyNeedsNoAws() {
        DomainSettings application = new DomainSettings();
        application.setName("application");
        SentinelConfig config = new SentinelConfig();
        config.setDomains(List.of(application));
        List<AutoCloseable> resources = new ArrayList<>();

        Map<String, MetricSource> sources = BaselineSentinelApp.sources(
                RunnerConfig.fromEnvironment(Map.of()), config, resources);

        assertThat(sources).containsOnlyKeys(BaselineSentinelApp.SOURCE_PROMETHEUS);
        assertThat(resources).isEmpty();
    }
}
