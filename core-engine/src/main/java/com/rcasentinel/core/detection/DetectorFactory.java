package com.rcasentinel.core.detection;

import com.rcasentinel.core.model.DetectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Creates the {@link SeriesDetector} for each {@link DetectionMethod}.
 *
 * <p>
 * This is the single point of extension when a detector is replaced: map the
 * method to its implementation here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
    }

    /**
     * @param method ensemble slot; must not be {@code null}
     * @return a detector with default parameters
     */
    public static SeriesDetector create(DetectionMethod method) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        return switch (method) {
            case ZSCORE -> new ZScoreDetector();
            case IQR -> new IqrDetector();
            case DENSITY_OUTLIER -> new DensityOutlierDetector();
            case CLUSTER_OUTLIER -> new ClusterOutlierDetector();
            case MOVING_AVERAGE -> new MovingAverageDetector();
            case STATIONARITY -> new StationarityDetector();
        };
    }

    /**
     * Create the full ensemble, one detector per method in declaration order.
     *
     * @return unmodifiable list of six detectors
     */
    public static List<SeriesDetector> createAll() {
        List<SeriesDetector> detectors = Arrays.stream(DetectionMethod.values())
                .map(DetectorFactory::create)
                .toList();
        LOG.debug("Created {} ensemble detector(s)", detectors.size());
        return Collections.unmodifiableList(detectors);
    }
}
