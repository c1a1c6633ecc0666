package com.baselinesentinel.runner;

import com.baselinesentinel.core.model.LabeledSeries;
import com.baselinesentinel.core.model.RawSeriesPoint;
import com.baselinesentinel.core.spi.MetricFetchException;
import com.baselinesentinel.core.spi.MetricQueryResult;
import com.baselinesentinel.core.spi.MetricSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MetricSource} backed by the Prometheus HTTP API
 * ({@code GET /api/v1/query_range}).
 *
 * <p>
 * Response handling:
 * </p>
 * <ul>
 * <li>non-2xx status, I/O error, timeout or interruption: {@link MetricFetchException}</li>
 * <li>{@code status != "success"} or no {@code data.result}: reported as-is,
 * the checks treat it as "no data"</li>
 * <li>sample values that do not parse as numbers are skipped</li>
 * </ul>
 *
 * <p>
 * The underlying {@link HttpClient} is thread-safe, so one instance serves
 * every domain of a run.
 * </p>
 */
public final class PrometheusMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(PrometheusMetricSource.class);

    private static final String QUERY_RANGE_PATH = "/api/v1/query_range";

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PrometheusMetricSource(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper());
    }

    PrometheusMetricSource(String baseUrl, Duration timeout, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public static PrometheusMetricSource from(RunnerConfig config) {
        return new PrometheusMetricSource(config.getMetricsBaseUrl(), config.getMetricsQueryTimeout());
    }

    @Override
    public MetricQueryResult queryRange(String query, Instant start, Instant end, Duration step)
            throws MetricFetchException {
        URI uri = buildUri(query, start, end, step);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetricFetchException("Interrupted while querying " + baseUrl, e);
        } catch (IOException e) {
            throw new MetricFetchException("Range query failed against " + baseUrl + ": " + e.getMessage(), e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new MetricFetchException(
                    "Range query returned HTTP " + response.statusCode() + " for query: " + query);
        }
        return parse(response.body());
    }

    URI buildUri(String query, Instant start, Instant end, Duration step) {
        return URI.create(baseUrl + QUERY_RANGE_PATH
                + "?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&start=" + start.getEpochSecond()
                + "&end=" + end.getEpochSecond()
                + "&step=" + step.getSeconds() + "s");
    }

    /**
     * Parse a {@code query_range} body.
     *
     * @throws MetricFetchException if the body is not JSON
     */
    MetricQueryResult parse(String body) throws MetricFetchException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MetricFetchException("Malformed range query response: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new MetricFetchException("Empty range query response");
        }

        String status = root.path("status").asText("");
        if (!MetricQueryResult.STATUS_SUCCESS.equals(status)) {
            LOG.warn("Range query reported status='{}' error='{}'", status, root.path("error").asText(""));
            return new MetricQueryResult(status, null);
        }

        JsonNode result = root.path("data").path("result");
        if (!result.isArray()) {
            return new MetricQueryResult(status, null);
        }

        List<LabeledSeries> series = new ArrayList<>(result.size());
        for (JsonNode entry : result) {
            series.add(new LabeledSeries(labels(entry.path("metric")), points(entry.path("values"))));
        }
        return MetricQueryResult.success(series);
    }

    private static Map<String, String> labels(JsonNode metric) {
        Map<String, String> labels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = metric.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }
        return labels;
    }

    private static List<RawSeriesPoint> points(JsonNode values) {
        List<RawSeriesPoint> points = new ArrayList<>(values.size());
        for (JsonNode pair : values) {
            if (!pair.isArray() || pair.size() < 2) {
                continue;
            }
            try {
                double ts = pair.get(0).asDouble();
                double value = Double.parseDouble(pair.get(1).asText());
                if (!Double.isFinite(value)) {
                    // Prometheus emits NaN and +/-Inf as strings
                    LOG.debug("Skipping non-finite sample {}", pair);
                    continue;
                }
                points.add(RawSeriesPoint.ofEpochSecond((long) ts, value));
            } catch (NumberFormatException e) {
                LOG.debug("Skipping non-numeric sample {}", pair);
            }
        }
        return points;
    }

    @Override
    public String toString() {
        return "PrometheusMetricSource{baseUrl='" + baseUrl + "', timeout=" + timeout + '}';
    }
}
