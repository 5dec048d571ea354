package com.incidentsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, unit-tagged time series measured against one resource.
 *
 * <p>
 * Points are kept in the order supplied, which adapters populate
 * chronologically. The series is not guaranteed to be gap-free.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String name;
    private final String unit;
    private final String resourceId;
    private final List<MetricPoint> points;

    /**
     * @param name       series name, e.g. {@code Percentage CPU}; must not be
     *                   {@code null}
     * @param unit       unit label, may be {@code null}
     * @param resourceId resource the series was measured against, may be
     *                   {@code null}
     * @param points     data points; must not be {@code null}
     */
    public MetricSeries(String name, String unit, String resourceId, List<MetricPoint> points) {
        this.name = Objects.requireNonNull(name, "Series name must not be null");
        this.unit = unit;
        this.resourceId = resourceId;
        Objects.requireNonNull(points, "Series points must not be null");
        this.points = List.copyOf(points);
    }

    public String getName() {
        return name;
    }

    public String getUnit() {
        return unit;
    }

    public String getResourceId() {
        return resourceId;
    }

    /**
     * @return unmodifiable list of points
     */
    public List<MetricPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return name.equals(that.name)
                && Objects.equals(unit, that.unit)
                && Objects.equals(resourceId, that.resourceId)
                && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unit, resourceId, points);
    }

    @Override
    public String toString() {
        return "MetricSeries{" +
                "name='" + name + '\'' +
                ", unit='" + unit + '\'' +
                ", resourceId='" + resourceId + '\'' +
                ", points=" + points.size() +
                '}';
    }
}
