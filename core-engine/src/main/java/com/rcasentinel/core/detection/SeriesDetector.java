package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;

/**
 * Contract for the members of the detection ensemble.
 *
 * <p>
 * A detector looks at the clean values of one metric, oldest first, and
 * returns one score per value in {@code [0, 1]}. Flagging detectors return
 * {@code 1.0} for a flagged value and {@code 0.0} otherwise; the stationarity
 * detector returns the same continuous score for every value.
 * </p>
 *
 * <p>
 * Implementations are stateless between calls and safe to share across
 * threads. A detector may throw on degenerate input; the ensemble then counts
 * it as zero for that metric.
 * </p>
 */
public interface SeriesDetector {

    /**
     * @param values finite values, oldest first
     * @return scores, same length as {@code values}
     */
    double[] score(double[] values);

    /**
     * @return the ensemble slot this detector fills
     */
    DetectionMethod method();
}
