package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.MetricPoint;
import com.incidentsentinel.core.model.MetricSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Trailing-window mean over a metric series.
 *
 * <p>
 * A point qualifies when it has an {@code average} and was sampled no more
 * than {@code windowMinutes} before {@code now}. Points whose average is
 * {@code null}, NaN or infinite are ignored; duplicate timestamps are each
 * counted.
 * </p>
 *
 * <p>
 * An empty result means "insufficient data" and must never be read as zero.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowAverager {

    private WindowAverager() {
        // utility class - not instantiable
    }

    /**
     * Average the qualifying points of a series.
     *
     * @param series        the series; must not be {@code null}
     * @param windowMinutes trailing window length in minutes; must be &gt;= 0
     * @param now           evaluation instant; must not be {@code null}
     * @return mean of qualifying averages, or empty when no point qualifies
     * @throws IllegalArgumentException if {@code windowMinutes} is negative
     */
    public static OptionalDouble recentAverage(MetricSeries series, int windowMinutes, Instant now) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (windowMinutes < 0) {
            throw new IllegalArgumentException("windowMinutes must be >= 0, got: " + windowMinutes);
        }

        Duration window = Duration.ofMinutes(windowMinutes);
        double sum = 0;
        int count = 0;
        for (MetricPoint point : series.getPoints()) {
            if (point.getTimestamp() == null || point.getAverage() == null
                    || !Double.isFinite(point.getAverage())) {
                continue;
            }
            if (Duration.between(point.getTimestamp(), now).compareTo(window) <= 0) {
                sum += point.getAverage();
                count++;
            }
        }
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    }
}
