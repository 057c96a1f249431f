package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import com.rcasentinel.core.stats.AdfTest;
import com.rcasentinel.core.stats.Descriptive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Scores how non-stationary a series looks.
 *
 * <p>
 * Runs an augmented Dickey-Fuller test and reports {@code min(1, 2 * p)} for
 * every value: a series whose unit root cannot be rejected scores high.
 * Series shorter than {@value AdfTest#MIN_OBSERVATIONS} values and constant
 * series score zero.
 * </p>
 *
 * @since 1.0.0
 */
public class StationarityDetector implements SeriesDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StationarityDetector.class);

    @Override
    public double[] score(double[] values) {
        double[] scores = new double[values.length];
        if (values.length < AdfTest.MIN_OBSERVATIONS || Descriptive.isConstant(values)) {
            return scores;
        }
        AdfTest test = AdfTest.run(values);
        double score = Math.min(1.0, 2.0 * test.getPValue());
        LOG.trace("Stationarity: {} -> score {}", test, score);
        Arrays.fill(scores, score);
        return scores;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.STATIONARITY;
    }
}
