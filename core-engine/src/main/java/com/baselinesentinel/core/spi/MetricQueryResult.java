package com.baselinesentinel.core.spi;

import com.baselinesentinel.core.model.LabeledSeries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed {@code query_range} response.
 *
 * @since 1.0.0
 */
public final class MetricQueryResult {

    public static final String STATUS_SUCCESS = "success";

    private static final MetricQueryResult EMPTY = new MetricQueryResult(STATUS_SUCCESS, List.of());

    private final String status;
    private final List<LabeledSeries> series;

    /**
     * @param status response status as reported by the source
     * @param series series; {@code null} when the payload carried none
     */
    public MetricQueryResult(String status, List<LabeledSeries> series) {
        this.status = status;
        this.series = series != null ? Collections.unmodifiableList(new ArrayList<>(series)) : null;
    }

    public static MetricQueryResult empty() {
        return EMPTY;
    }

    public static MetricQueryResult success(List<LabeledSeries> series) {
        return new MetricQueryResult(STATUS_SUCCESS, series);
    }

    public String getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equalsIgnoreCase(status);
    }

    /**
     * @return the series when the response succeeded and carried any, an
     *         empty list otherwise
     */
    public List<LabeledSeries> seriesOrEmpty() {
        return isSuccess() && series != null ? series : List.of();
    }

    @Override
    public String toString() {
        return "MetricQueryResult{status='" + status + "', series="
                + (series == null ? "missing" : series.size()) + '}';
    }
}
