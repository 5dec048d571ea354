package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.IncidentType;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricPoint;
import com.incidentsentinel.core.model.MetricSeries;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.model.RuleDefinition;
import com.incidentsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.incidentsentinel.core.detection.Snapshots.NOW;
import static com.incidentsentinel.core.detection.Snapshots.RESOURCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CpuUtilizationRule}.
 */
class CpuUtilizationRuleTest {

    private CpuUtilizationRule rule;

    @BeforeEach
    void setUp() {
        rule = new CpuUtilizationRule(Snapshots.rule("high_cpu", "cpu", 80.0));
    }

    @Test
    @DisplayName("Should fire a High incident when CPU averages 85% against 80%")
    void shouldFireAboveThreshold() {
        Optional<Incident> incident = rule.evaluate(Snapshots.cpu(85.0), NOW);

        assertThat(incident).isPresent();
        assertThat(incident.get().getType()).isEqualTo(IncidentType.HIGH_CPU);
        assertThat(incident.get().getType().getDisplayName()).isEqualTo("High CPU Utilization");
        assertThat(incident.get().getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(incident.get().getResourceId()).isEqualTo(RESOURCE);
        assertThat(incident.get().getTimestamp()).isEqualTo(NOW);
        assertThat(incident.get().getDetails())
                .isEqualTo("Average CPU usage (85.00%) exceeded threshold (80.0%) for the last 5 minutes.");
    }

    @Test
    @DisplayName("Should fire when CPU equals the threshold exactly")
    void shouldFireAtExactThreshold() {
        assertThat(rule.evaluate(Snapshots.cpu(80.0), NOW)).isPresent();
    }

    @Test
    @DisplayName("Should NOT fire when CPU is below threshold")
    void shouldNotFireBelowThreshold() {
        assertThat(rule.evaluate(Snapshots.cpu(79.99), NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should only use the first series of the snapshot")
    void shouldUseFirstSeries() {
        MetricSnapshot snapshot = new MetricSnapshot(RESOURCE, MetricKind.CPU, List.of(
                Snapshots.flat("Percentage CPU", 10.0, 5),
                Snapshots.flat("Percentage CPU (other)", 99.0, 5)));

        assertThat(rule.evaluate(snapshot, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when the snapshot has no series")
    void shouldNotFireOnEmptySnapshot() {
        MetricSnapshot snapshot = new MetricSnapshot(RESOURCE, MetricKind.CPU, List.of());

        assertThat(rule.evaluate(snapshot, NOW)).isEmpty();
        assertThat(rule.evaluate(null, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire when every sample is older than the window")
    void shouldNotFireOnStaleData() {
        MetricSeries stale = new MetricSeries("Percentage CPU", "Percent", RESOURCE,
                List.of(MetricPoint.of(NOW.minusSeconds(3600), 99.0)));
        MetricSnapshot snapshot = new MetricSnapshot(RESOURCE, MetricKind.CPU, List.of(stale));

        assertThat(rule.evaluate(snapshot, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to the snapshot resource when the series has none")
    void shouldFallBackToSnapshotResource() {
        MetricSeries series = new MetricSeries("Percentage CPU", "Percent", null,
                List.of(MetricPoint.of(NOW, 95.0)));
        MetricSnapshot snapshot = new MetricSnapshot("vm-from-snapshot", MetricKind.CPU, List.of(series));

        Optional<Incident> incident = rule.evaluate(snapshot, NOW);

        assertThat(incident).isPresent();
        assertThat(incident.get().getResourceId()).isEqualTo("vm-from-snapshot");
    }

    @Test
    @DisplayName("Should honour configured severity and window in the details")
    void shouldUseConfiguredSeverityAndWindow() {
        RuleDefinition definition = Snapshots.rule("cpu_low_sev", "cpu", 50.5);
        definition.setSeverity("low");
        definition.setWindowMinutes(3);
        CpuUtilizationRule custom = new CpuUtilizationRule(definition);

        Optional<Incident> incident = custom.evaluate(Snapshots.cpu(60.0), NOW);

        assertThat(incident).isPresent();
        assertThat(incident.get().getSeverity()).isEqualTo(Severity.LOW);
        assertThat(incident.get().getDetails())
                .contains("(60.00%)", "(50.5%)", "last 3 minutes");
    }

    @Test
    @DisplayName("Should NOT fire when the only CPU sample is NaN")
    void shouldNotFireOnNanSample() {
        MetricSnapshot snapshot = new MetricSnapshot(RESOURCE, MetricKind.CPU, List.of(
                new MetricSeries("Percentage CPU", "Percent", RESOURCE,
                        List.of(MetricPoint.of(NOW.minusSeconds(60), Double.NaN)))));

        assertThat(rule.evaluate(snapshot, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should render very large thresholds in plain notation")
    void shouldRenderLargeThresholdPlainly() {
        CpuUtilizationRule huge = new CpuUtilizationRule(Snapshots.rule("huge", "cpu", 1.0E7));

        Optional<Incident> incident = huge.evaluate(Snapshots.cpu(2.0E7), NOW);

        assertThat(incident).isPresent();
        assertThat(incident.get().getDetails())
                .isEqualTo("Average CPU usage (20000000.00%) exceeded threshold (10000000.0%)"
                        + " for the last 5 minutes.");
    }

    @Test
    @DisplayName("Should reject a non-positive window at construction")
    void shouldRejectInvalidWindow() {
        RuleDefinition definition = Snapshots.rule("bad", "cpu", 80.0);
        definition.setWindowMinutes(0);

        assertThatThrownBy(() -> new CpuUtilizationRule(definition))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowMinutes");
    }
}
