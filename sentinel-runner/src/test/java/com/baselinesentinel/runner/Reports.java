package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.AnomalyRecord;
import com.baselinesentinel.core.model.AnomalyReport;
import com.baselinesentinel.core.model.AnomalyType;
import com.baselinesentinel.core.model.DeploymentRecord;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.TimeWindow;
import com.baselinesentinel.core.model.WindowPair;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Report fixtures shared by the sink and serializer tests.
 */
final class Reports {

    static final Instant CURRENT_START = Instant.parse("2024-01-15T06:00:00Z");
    static final Instant PAST_START = Instant.parse("2024-01-08T06:00:00Z");

    private Reports() {
    }

    static WindowPair windows() {
        return new WindowPair(
                TimeWindow.of(CURRENT_START, CURRENT_START.plus(Duration.ofHours(1))),
                TimeWindow.of(PAST_START, PAST_START.plus(Duration.ofHours(1))));
    }

    static AnomalyReport sample() {
        AnomalyRecord growth = AnomalyRecord.builder()
                .domain("application")
                .check("api_requests")
                .type(AnomalyType.BASELINE_GROWTH)
                .entity(EntityKey.of("GET", "orders", "/api/orders"))
                .metric("5xx")
                .currentValue(300)
                .pastValue(200.0)
                .percentChange(50.0)
                .threshold(30)
                .magnitude(50.0)
                .build();
        AnomalyRecord breach = AnomalyRecord.builder()
                .domain("cache")
                .check("redis_cpu")
                .type(AnomalyType.SUSTAINED_BREACH)
                .entity(EntityKey.of("redis-001"))
                .metric("redis_cpu")
                .currentValue(91.5)
                .threshold(75)
                .breachIndices(List.of(1, 2))
                .magnitude(180.0)
                .build();
        return AnomalyReport.builder()
                .window(windows())
                .domain("application", List.of(growth))
                .domain("database", List.of())
                .domain("cache", List.of(breach))
                .deployments(List.of(new DeploymentRecord(
                        "orders", "prod", Instant.parse("2024-01-14T09:30:00Z"), 2)))
                .build();
    }
}
