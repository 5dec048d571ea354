package com.incidentsentinel.service;

import com.incidentsentinel.core.detection.DetectionReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for detection cycles.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code incident_sentinel.cycles_total} – completed cycles</li>
 *   <li>{@code incident_sentinel.incidents_detected_total} – incidents returned by cycles</li>
 *   <li>{@code incident_sentinel.store_errors_total} – failed incident appends</li>
 *   <li>{@code incident_sentinel.fetch_errors_total} – failed metric fetches</li>
 *   <li>{@code incident_sentinel.cycle_latency} – wall time per cycle</li>
 * </ul>
 */
public class DetectionMetrics {

    private final MeterRegistry registry;
    private final Counter cycles;
    private final Counter incidentsDetected;
    private final Counter storeErrors;
    private final Counter fetchErrors;
    private final Timer cycleLatency;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.cycles = Counter.builder("incident_sentinel.cycles_total")
                .description("Completed detection cycles")
                .register(registry);
        this.incidentsDetected = Counter.builder("incident_sentinel.incidents_detected_total")
                .description("Incidents produced by detection cycles")
                .register(registry);
        this.storeErrors = Counter.builder("incident_sentinel.store_errors_total")
                .description("Incidents that could not be persisted")
                .register(registry);
        this.fetchErrors = Counter.builder("incident_sentinel.fetch_errors_total")
                .description("Metric fetches that failed")
                .register(registry);
        this.cycleLatency = Timer.builder("incident_sentinel.cycle_latency")
                .description("Wall time of one detection cycle")
                .register(registry);
    }

    public void recordCycle(DetectionReport report, Duration elapsed) {
        cycles.increment();
        incidentsDetected.increment(report.getIncidents().size());
        storeErrors.increment(report.getStoreErrorCount());
        fetchErrors.increment(report.getFetchErrors().size());
        cycleLatency.record(elapsed);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public double cycleCount() {
        return cycles.count();
    }

    public double incidentCount() {
        return incidentsDetected.count();
    }

    public double storeErrorCount() {
        return storeErrors.count();
    }

    public double fetchErrorCount() {
        return fetchErrors.count();
    }
}
