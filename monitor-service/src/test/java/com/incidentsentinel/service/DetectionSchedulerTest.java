package com.incidentsentinel.service;

import com.incidentsentinel.core.config.RulesLoader;
import com.incidentsentinel.core.detection.DetectionEngine;
import com.incidentsentinel.core.detection.DetectionReport;
import com.incidentsentinel.core.detection.RuleFactory;
import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.IncidentType;
import com.incidentsentinel.core.store.InMemoryIncidentStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static com.incidentsentinel.service.Fixtures.CLOCK;
import static com.incidentsentinel.service.Fixtures.RESOURCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DetectionScheduler} and {@link DetectionMetrics} against
 * the bundled rules and the metrics fixtures.
 */
class DetectionSchedulerTest {

    private InMemoryIncidentStore store;
    private SimpleMeterRegistry registry;
    private DetectionMetrics metrics;
    private DetectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryIncidentStore();
        registry = new SimpleMeterRegistry();
        metrics = new DetectionMetrics(registry);
        DetectionEngine engine = new DetectionEngine(
                new FileMetricsSource(Fixtures.metricsDir(), CLOCK), store,
                RuleFactory.createAll(RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).getRules()),
                CLOCK);
        scheduler = new DetectionScheduler(engine, metrics, RESOURCE, 10);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    @DisplayName("Should detect CPU, memory and network incidents from the fixtures")
    void shouldDetectAllThree() {
        DetectionReport report = scheduler.runCycleNow();

        assertThat(report.hasFetchErrors()).isFalse();
        assertThat(report.getIncidents()).extracting(Incident::getType)
                .containsExactly(IncidentType.HIGH_CPU, IncidentType.LOW_MEMORY, IncidentType.HIGH_NETWORK);
        assertThat(report.getIncidents()).extracting(Incident::getDetails).containsExactly(
                "Average CPU usage (85.00%) exceeded threshold (80.0%) for the last 5 minutes.",
                "Average available memory (1.50 GB) fell below threshold (2.0 GB) for the last 5 minutes.",
                "Average total network traffic (110.00 KBps) exceeded threshold (100.0 KBps)"
                        + " for the last 5 minutes. (In: 60.00 KBps, Out: 50.00 KBps)");
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should record cycle counters and latency")
    void shouldRecordMetrics() {
        scheduler.runCycleNow();
        scheduler.runCycleNow();

        assertThat(metrics.cycleCount()).isEqualTo(2.0);
        assertThat(metrics.incidentCount()).isEqualTo(6.0);
        assertThat(metrics.storeErrorCount()).isZero();
        assertThat(metrics.fetchErrorCount()).isZero();
        assertThat(registry.get("incident_sentinel.cycle_latency").timer().count()).isEqualTo(2L);
        assertThat(registry.get("incident_sentinel.incidents_detected_total").counter().count()).isEqualTo(6.0);
    }

    @Test
    @DisplayName("Should run the first scheduled cycle immediately")
    void shouldRunOnSchedule() throws InterruptedException {
        scheduler.start(3600);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (metrics.cycleCount() < 1 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }

        assertThat(metrics.cycleCount()).isEqualTo(1.0);
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should refuse a second start and a non-positive interval")
    void shouldValidateStart() {
        assertThatThrownBy(() -> scheduler.start(0))
                .isInstanceOf(IllegalArgumentException.class);

        scheduler.start(3600);
        assertThatThrownBy(() -> scheduler.start(3600))
                .isInstanceOf(IllegalStateException.class);

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }
}
