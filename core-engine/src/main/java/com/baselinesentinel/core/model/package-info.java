/**
 * Domain model of the Baseline Sentinel detection engine.
 *
 * <p>
 * Everything in this package is created fresh per detection run and
 * discarded once the report has been produced:
 * </p>
 * <ul>
 * <li>{@link com.baselinesentinel.core.model.TimeWindow} /
 * {@link com.baselinesentinel.core.model.WindowPair}: UTC observation
 * windows</li>
 * <li>{@link com.baselinesentinel.core.model.LabeledSeries}: raw labelled
 * series from the metric source</li>
 * <li>{@link com.baselinesentinel.core.model.EntityKey},
 * {@link com.baselinesentinel.core.model.CategoryHistogram},
 * {@link com.baselinesentinel.core.model.GaugeTrack}: normalized
 * aggregates</li>
 * <li>{@link com.baselinesentinel.core.model.AnomalyRecord} /
 * {@link com.baselinesentinel.core.model.AnomalyReport}: detection
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.baselinesentinel.core.model;
