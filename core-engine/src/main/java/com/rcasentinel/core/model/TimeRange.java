package com.rcasentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed time interval {@code [start, end]} covered by an analysis.
 *
 * @since 1.0.0
 */
public final class TimeRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant start;
    private final Instant end;

    private TimeRange(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @param start inclusive start; must not be {@code null}
     * @param end   inclusive end; must not be {@code null}
     * @return the range
     * @throws IllegalArgumentException if {@code end} is before {@code start}
     */
    public static TimeRange of(Instant start, Instant end) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
        }
        return new TimeRange(start, end);
    }

    /**
     * Smallest range covering every clean sample of the given series.
     *
     * @param series the series to cover
     * @return the covering range, or empty if no series has a clean sample
     */
    public static Optional<TimeRange> covering(Collection<MetricSeries> series) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (MetricSeries s : series) {
            double[] ts = s.cleanTimestamps();
            if (ts.length > 0) {
                min = Math.min(min, ts[0]);
                max = Math.max(max, ts[ts.length - 1]);
            }
        }
        if (min > max) {
            return Optional.empty();
        }
        return Optional.of(of(MetricSeries.toInstant(min), MetricSeries.toInstant(max)));
    }

    @JsonProperty("start")
    public Instant getStart() {
        return start;
    }

    @JsonProperty("end")
    public Instant getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
