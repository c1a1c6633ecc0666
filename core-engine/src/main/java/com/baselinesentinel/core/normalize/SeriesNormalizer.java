package com.baselinesentinel.core.normalize;

import com.baselinesentinel.core.model.Aggregated;
import com.baselinesentinel.core.model.BucketingMode;
import com.baselinesentinel.core.model.Category;
import com.baselinesentinel.core.model.CategoryHistogram;
import com.baselinesentinel.core.model.EntityKey;
import com.baselinesentinel.core.model.GaugeTrack;
import com.baselinesentinel.core.model.LabeledSeries;
import com.baselinesentinel.core.model.RawSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Groups raw series into per-entity aggregates.
 *
 * <h3>Histogram mode</h3>
 * <p>
 * With a code field, each series is classified once by its code label and
 * the sum of all of its point values, truncated to a whole count, is added
 * to that category of the entity's {@link CategoryHistogram}. A series thus
 * contributes to exactly one category.
 * </p>
 *
 * <h3>Sequence mode</h3>
 * <p>
 * Without a code field, each entity keeps its ordered values with parallel
 * timestamps. Series that map to the same entity are merged by summing the
 * values at equal timestamps.
 * </p>
 *
 * <p>
 * Non-finite samples are dropped. Missing labels become {@value LabeledSeries#UNKNOWN}. Empty or
 * {@code null} input yields an empty aggregate; this class never throws for
 * data it is given.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesNormalizer.class);

    private final List<String> keyFields;
    private final EntityFilter filter;

    /**
     * @param keyFields ordered label names forming the entity key
     * @param filter    entities to keep
     */
    public SeriesNormalizer(List<String> keyFields, EntityFilter filter) {
        Objects.requireNonNull(keyFields, "Key fields must not be null");
        this.keyFields = List.copyOf(keyFields);
        this.filter = filter != null ? filter : EntityFilter.acceptAll();
    }

    public SeriesNormalizer(List<String> keyFields) {
        this(keyFields, EntityFilter.acceptAll());
    }

    /**
     * Normalize into histograms when {@code codeField} is set, sequences
     * otherwise.
     *
     * @param series    series of one metric response, may be {@code null}
     * @param codeField code label name, or {@code null} for gauge tracks
     * @param mode      bucketing mode for histograms
     * @return tagged aggregate
     */
    public Aggregated normalize(List<LabeledSeries> series, String codeField, BucketingMode mode) {
        if (codeField == null || codeField.isBlank()) {
            return Aggregated.sequences(sequences(series));
        }
        return Aggregated.histograms(histograms(series, codeField, mode));
    }

    // ---------------------------------------------------------------
    // Histograms
    // ---------------------------------------------------------------

    /**
     * @return histogram per entity, in first-seen order
     */
    public Map<EntityKey, CategoryHistogram> histograms(List<LabeledSeries> series, String codeField,
            BucketingMode mode) {
        Objects.requireNonNull(codeField, "Code field must not be null");
        BucketingMode bucketing = mode != null ? mode : BucketingMode.STATUS_CODE;
        Map<EntityKey, CategoryHistogram> result = new LinkedHashMap<>();
        if (series == null) {
            return result;
        }
        for (LabeledSeries s : series) {
            if (s == null) {
                continue;
            }
            EntityKey key = s.keyOf(keyFields);
            if (!filter.test(key)) {
                LOG.trace("Skipping filtered entity {}", key);
                continue;
            }
            Category category = CategoryClassifier.classify(s.label(codeField), bucketing);
            result.computeIfAbsent(key, k -> new CategoryHistogram(bucketing))
                    .add(category, (long) s.sum());
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Sequences
    // ---------------------------------------------------------------

    /**
     * @return gauge track per entity, in first-seen order
     */
    public Map<EntityKey, GaugeTrack> sequences(List<LabeledSeries> series) {
        Map<EntityKey, TreeMap<Instant, Double>> merged = new LinkedHashMap<>();
        if (series != null) {
            for (LabeledSeries s : series) {
                if (s == null) {
                    continue;
                }
                EntityKey key = s.keyOf(keyFields);
                if (!filter.test(key)) {
                    LOG.trace("Skipping filtered entity {}", key);
                    continue;
                }
                mergeInto(merged.computeIfAbsent(key, k -> new TreeMap<>()), s);
            }
        }
        return toTracks(merged);
    }

    /**
     * Group by entity key plus code category, e.g. {@code (service, 5xx)}.
     * Series of the same service whose codes fall into the same category
     * (500 and 503) are summed per timestamp.
     *
     * @return gauge track per (entity, category label)
     */
    public Map<EntityKey, GaugeTrack> categorySequences(List<LabeledSeries> series, String codeField,
            BucketingMode mode) {
        Objects.requireNonNull(codeField, "Code field must not be null");
        BucketingMode bucketing = mode != null ? mode : BucketingMode.STATUS_CODE;
        Map<EntityKey, TreeMap<Instant, Double>> merged = new LinkedHashMap<>();
        if (series != null) {
            for (LabeledSeries s : series) {
                if (s == null) {
                    continue;
                }
                EntityKey entity = s.keyOf(keyFields);
                if (!filter.test(entity)) {
                    LOG.trace("Skipping filtered entity {}", entity);
                    continue;
                }
                Category category = CategoryClassifier.classify(s.label(codeField), bucketing);
                mergeInto(merged.computeIfAbsent(entity.with(category.label()), k -> new TreeMap<>()), s);
            }
        }
        return toTracks(merged);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void mergeInto(TreeMap<Instant, Double> target, LabeledSeries s) {
        for (RawSeriesPoint point : s.getPoints()) {
            if (!Double.isFinite(point.getValue())) {
                LOG.trace("Dropping non-finite sample {}", point);
                continue;
            }
            target.merge(point.getTimestamp(), point.getValue(), Double::sum);
        }
    }

    private static Map<EntityKey, GaugeTrack> toTracks(Map<EntityKey, TreeMap<Instant, Double>> merged) {
        Map<EntityKey, GaugeTrack> result = new LinkedHashMap<>();
        merged.forEach((key, points) -> result.put(key,
                new GaugeTrack(new ArrayList<>(points.keySet()), new ArrayList<>(points.values()))));
        return result;
    }

    public List<String> getKeyFields() {
        return keyFields;
    }
}
