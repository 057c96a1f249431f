/**
 * Domain model classes for RCA Sentinel.
 *
 * <p>
 * Input side:
 * </p>
 * <ul>
 * <li>{@link com.rcasentinel.core.model.MetricSample} - one collected
 * observation</li>
 * <li>{@link com.rcasentinel.core.model.MetricSeries} - immutable, time-ordered
 * series of one metric</li>
 * </ul>
 *
 * <p>
 * Output side, serialized with snake_case property names:
 * </p>
 * <ul>
 * <li>{@link com.rcasentinel.core.model.AnomalyReport} - per-metric ensemble
 * findings</li>
 * <li>{@link com.rcasentinel.core.model.CorrelationEdge} - significant pairwise
 * correlation</li>
 * <li>{@link com.rcasentinel.core.model.RootCauseCandidate} - ranked
 * hypothesis</li>
 * <li>{@link com.rcasentinel.core.model.AnalysisResult} - everything above plus
 * summary and statistics</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.model;
