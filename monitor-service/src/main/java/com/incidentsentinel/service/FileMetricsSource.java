package com.incidentsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricPoint;
import com.incidentsentinel.core.model.MetricSeries;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.spi.MetricsFetchException;
import com.incidentsentinel.core.spi.MetricsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link MetricsSource} that reads metric query results from JSON files.
 *
 * <p>
 * One file per kind, named {@code <dir>/<kind>.json} ({@code cpu.json},
 * {@code memory.json}, {@code network.json}), in the monitoring query
 * response shape:
 * </p>
 *
 * <pre>
 * {"value": [
 *   {"name": {"value": "Percentage CPU"}, "unit": "Percent",
 *    "resourceId": "/subscriptions/.../vm1",
 *    "timeseries": [{"data": [
 *      {"timeStamp": "2026-10-17T11:58:00Z", "average": 85.0}
 *    ]}]}
 * ]}
 * </pre>
 *
 * <p>
 * {@code name} may also be a plain string. Points outside the requested
 * window (relative to the clock) are dropped, as the monitoring query would.
 * Every point keeps whichever of {@code average}, {@code count},
 * {@code minimum}, {@code maximum} and {@code total} it carries; a missing
 * average is derived from {@code total / count}, or from equal
 * {@code minimum} and {@code maximum}, when possible.
 * </p>
 */
public class FileMetricsSource implements MetricsSource {

    private static final Logger LOG = LoggerFactory.getLogger(FileMetricsSource.class);

    private final Path dataDir;
    private final Clock clock;

    public FileMetricsSource(Path dataDir, Clock clock) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public MetricSnapshot fetch(String resourceId, int windowMinutes, MetricKind kind)
            throws MetricsFetchException {
        Objects.requireNonNull(kind, "kind must not be null");
        if (windowMinutes <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0, got: " + windowMinutes);
        }
        Path file = dataDir.resolve(kind.pathName() + ".json");
        if (!Files.isRegularFile(file)) {
            throw new MetricsFetchException(kind, "No metrics file for " + kind + " at " + file);
        }

        JsonNode root;
        try {
            root = IncidentJson.mapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new MetricsFetchException(kind, "Unreadable metrics file " + file + ": " + e.getMessage(), e);
        }

        JsonNode values = root == null ? null : root.get("value");
        if (values == null || !values.isArray() || values.isEmpty()) {
            throw new MetricsFetchException(kind, "No metric series returned for " + kind);
        }

        Instant from = clock.instant().minus(Duration.ofMinutes(windowMinutes));
        List<MetricSeries> series = new ArrayList<>(values.size());
        for (JsonNode metric : values) {
            series.add(toSeries(metric, resourceId, from, kind));
        }
        LOG.debug("Read {} series for {} from {}", series.size(), kind, file);
        return new MetricSnapshot(resourceId, kind, series);
    }

    // ---------------------------------------------------------------
    // Normalisation
    // ---------------------------------------------------------------

    private static MetricSeries toSeries(JsonNode metric, String requestedResource, Instant from,
            MetricKind kind) throws MetricsFetchException {
        String name = seriesName(metric.get("name"));
        if (name == null) {
            throw new MetricsFetchException(kind, "Metric series without a name for " + kind);
        }
        String unit = text(metric, "unit");
        String resourceId = text(metric, "resourceId");

        List<MetricPoint> points = new ArrayList<>();
        JsonNode timeseries = metric.get("timeseries");
        if (timeseries != null && timeseries.isArray() && !timeseries.isEmpty()) {
            JsonNode data = timeseries.get(0).get("data");
            if (data != null && data.isArray()) {
                for (JsonNode raw : data) {
                    MetricPoint point = toPoint(raw, kind);
                    if (point != null && !point.getTimestamp().isBefore(from)) {
                        points.add(point);
                    }
                }
            }
        }
        return new MetricSeries(name, unit, resourceId != null ? resourceId : requestedResource, points);
    }

    private static MetricPoint toPoint(JsonNode raw, MetricKind kind) {
        String ts = text(raw, "timeStamp");
        if (ts == null) {
            ts = text(raw, "timestamp");
        }
        if (ts == null) {
            LOG.trace("Dropping {} point without timestamp", kind);
            return null;
        }
        Instant timestamp;
        try {
            timestamp = Instant.parse(ts);
        } catch (DateTimeParseException e) {
            LOG.trace("Dropping {} point with unparseable timestamp '{}'", kind, ts);
            return null;
        }

        Double count = number(raw, "count");
        Double total = number(raw, "total");
        Double minimum = number(raw, "minimum");
        Double maximum = number(raw, "maximum");
        Double average = number(raw, "average");
        if (average == null && total != null && count != null && count > 0) {
            average = total / count;
        }
        if (average == null && minimum != null && minimum.equals(maximum)) {
            average = minimum;
        }
        return MetricPoint.builder()
                .timestamp(timestamp)
                .average(average)
                .count(count)
                .minimum(minimum)
                .maximum(maximum)
                .total(total)
                .build();
    }

    static String seriesName(JsonNode name) {
        if (name == null || name.isNull()) {
            return null;
        }
        if (name.isTextual()) {
            return name.asText();
        }
        JsonNode value = name.get("value");
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isNumber() ? v.asDouble() : null;
    }
}
