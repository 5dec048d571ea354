package com.incidentsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything returned by one fetch: one or more named series for a single
 * resource and metric kind.
 *
 * <p>
 * A CPU fetch typically yields one series; a network fetch yields two
 * ({@code Network In Total} and {@code Network Out Total}). A snapshot is
 * owned by the detection cycle that fetched it and discarded afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSnapshot {

    private final String resourceId;
    private final MetricKind kind;
    private final List<MetricSeries> series;

    public MetricSnapshot(String resourceId, MetricKind kind, List<MetricSeries> series) {
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(series, "series must not be null");
        this.series = List.copyOf(series);
    }

    public String getResourceId() {
        return resourceId;
    }

    public MetricKind getKind() {
        return kind;
    }

    /**
     * @return unmodifiable list of series in fetch order
     */
    public List<MetricSeries> getSeries() {
        return Collections.unmodifiableList(series);
    }

    /**
     * @return the first series, or empty if the snapshot has none
     */
    public Optional<MetricSeries> firstSeries() {
        return series.isEmpty() ? Optional.empty() : Optional.of(series.get(0));
    }

    /**
     * Look up a series by its exact name.
     *
     * @param name series name
     * @return the first series with that name, or empty
     */
    public Optional<MetricSeries> seriesNamed(String name) {
        return series.stream()
                .filter(s -> s.getName().equals(name))
                .findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return series.isEmpty();
    }

    @Override
    public String toString() {
        return "MetricSnapshot{" +
                "resourceId='" + resourceId + '\'' +
                ", kind=" + kind +
                ", series=" + series +
                '}';
    }
}
