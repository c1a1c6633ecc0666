package com.baselinesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of normalizing one metric response: either category histograms or
 * gauge sequences per entity.
 *
 * <p>
 * Callers branch on {@link #getKind()} and use the matching accessor; the
 * other accessor throws {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class Aggregated {

    /** Shape of the aggregate. */
    public enum Kind {
        HISTOGRAM,
        SEQUENCE
    }

    private Aggregated() {
    }

    public static Aggregated histograms(Map<EntityKey, CategoryHistogram> histograms) {
        return new Histograms(histograms);
    }

    public static Aggregated sequences(Map<EntityKey, GaugeTrack> tracks) {
        return new Sequences(tracks);
    }

    public abstract Kind getKind();

    public abstract int size();

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return histograms per entity
     * @throws IllegalStateException if this aggregate holds sequences
     */
    public Map<EntityKey, CategoryHistogram> asHistograms() {
        throw new IllegalStateException("Aggregate of kind " + getKind() + " holds no histograms");
    }

    /**
     * @return gauge tracks per entity
     * @throws IllegalStateException if this aggregate holds histograms
     */
    public Map<EntityKey, GaugeTrack> asSequences() {
        throw new IllegalStateException("Aggregate of kind " + getKind() + " holds no sequences");
    }

    private static final class Histograms extends Aggregated {
        private final Map<EntityKey, CategoryHistogram> histograms;

        Histograms(Map<EntityKey, CategoryHistogram> histograms) {
            Objects.requireNonNull(histograms, "Histograms must not be null");
            this.histograms = Collections.unmodifiableMap(new LinkedHashMap<>(histograms));
        }

        @Override
        public Kind getKind() {
            return Kind.HISTOGRAM;
        }

        @Override
        public int size() {
            return histograms.size();
        }

        @Override
        public Map<EntityKey, CategoryHistogram> asHistograms() {
            return histograms;
        }

        @Override
        public String toString() {
            return "Aggregated.Histograms" + histograms;
        }
    }

    private static final class Sequences extends Aggregated {
        private final Map<EntityKey, GaugeTrack> tracks;

        Sequences(Map<EntityKey, GaugeTrack> tracks) {
            Objects.requireNonNull(tracks, "Tracks must not be null");
            this.tracks = Collections.unmodifiableMap(new LinkedHashMap<>(tracks));
        }

        @Override
        public Kind getKind() {
            return Kind.SEQUENCE;
        }

        @Override
        public int size() {
            return tracks.size();
        }

        @Override
        public Map<EntityKey, GaugeTrack> asSequences() {
            return tracks;
        }

        @Override
        public String toString() {
            return "Aggregated.Sequences" + tracks;
        }
    }
}
