package com.incidentsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A single aggregated sample of a metric time series.
 *
 * <p>
 * Only the {@code timestamp} is mandatory. Every numeric aggregate is
 * independently optional because upstream aggregation intervals can be sparse;
 * a {@code null} aggregate means "not reported", never zero.
 * </p>
 *
 * <p>
 * Instances are immutable. Use {@link #of(Instant, Double)} for the common
 * average-only case, or the {@link Builder} when more aggregates are known.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MetricPoint {

    private final Instant timestamp;
    private final Double average;
    private final Double count;
    private final Double minimum;
    private final Double maximum;
    private final Double total;

    private MetricPoint(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.average = builder.average;
        this.count = builder.count;
        this.minimum = builder.minimum;
        this.maximum = builder.maximum;
        this.total = builder.total;
    }

    /**
     * Create a point that carries only an average.
     *
     * @param timestamp sample time; must not be {@code null}
     * @param average   average value, may be {@code null}
     * @return new point
     */
    public static MetricPoint of(Instant timestamp, Double average) {
        return builder().timestamp(timestamp).average(average).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link MetricPoint}. {@code timestamp} is required.
     */
    public static class Builder {
        private Instant timestamp;
        private Double average;
        private Double count;
        private Double minimum;
        private Double maximum;
        private Double total;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder average(Double average) {
            this.average = average;
            return this;
        }

        public Builder count(Double count) {
            this.count = count;
            return this;
        }

        public Builder minimum(Double minimum) {
            this.minimum = minimum;
            return this;
        }

        public Builder maximum(Double maximum) {
            this.maximum = maximum;
            return this;
        }

        public Builder total(Double total) {
            this.total = total;
            return this;
        }

        /**
         * @return a new {@link MetricPoint}
         * @throws NullPointerException if {@code timestamp} is {@code null}
         */
        public MetricPoint build() {
            return new MetricPoint(this);
        }
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Double getAverage() {
        return average;
    }

    public Double getCount() {
        return count;
    }

    public Double getMinimum() {
        return minimum;
    }

    public Double getMaximum() {
        return maximum;
    }

    public Double getTotal() {
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return timestamp.equals(that.timestamp)
                && Objects.equals(average, that.average)
                && Objects.equals(count, that.count)
                && Objects.equals(minimum, that.minimum)
                && Objects.equals(maximum, that.maximum)
                && Objects.equals(total, that.total);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, average, count, minimum, maximum, total);
    }

    @Override
    public String toString() {
        return "MetricPoint{" +
                "timestamp=" + timestamp +
                ", average=" + average +
                ", count=" + count +
                ", minimum=" + minimum +
                ", maximum=" + maximum +
                ", total=" + total +
                '}';
    }
}
