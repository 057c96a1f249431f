/**
 * Ensemble anomaly detection over metric time series.
 *
 * <p>
 * Every ensemble member implements
 * {@link com.rcasentinel.core.detection.SeriesDetector} and is created by
 * {@link com.rcasentinel.core.detection.DetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.rcasentinel.core.detection.ZScoreDetector}: distance from the
 * mean in standard deviations</li>
 * <li>{@link com.rcasentinel.core.detection.IqrDetector}: Tukey fences</li>
 * <li>{@link com.rcasentinel.core.detection.DensityOutlierDetector}: isolated
 * by nearest-neighbour distance</li>
 * <li>{@link com.rcasentinel.core.detection.ClusterOutlierDetector}: DBSCAN
 * noise</li>
 * <li>{@link com.rcasentinel.core.detection.MovingAverageDetector}: deviation
 * from a trailing baseline</li>
 * <li>{@link com.rcasentinel.core.detection.StationarityDetector}: unit-root
 * test, one score per series</li>
 * </ul>
 *
 * <p>
 * {@link com.rcasentinel.core.detection.AnomalyDetector} combines them into a
 * weighted composite score per sample.
 * </p>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.detection;
