package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.IncidentType;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricSeries;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.model.RuleDefinition;
import com.incidentsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * High CPU rule.
 *
 * <p>
 * Averages the first series of the CPU snapshot ({@code Percentage CPU}) over
 * the trailing window and fires when the average is at or above the
 * threshold. Default severity is {@link Severity#HIGH}.
 * </p>
 *
 * @since 1.0.0
 */
public class CpuUtilizationRule implements IncidentRule {

    private static final Logger LOG = LoggerFactory.getLogger(CpuUtilizationRule.class);

    private final String ruleName;
    private final double thresholdPercent;
    private final int windowMinutes;
    private final Severity severity;

    /**
     * @param rule the rule configuration
     * @throws NullPointerException     if {@code rule} or its name is
     *                                  {@code null}
     * @throws IllegalArgumentException if {@code windowMinutes} is not positive
     */
    public CpuUtilizationRule(RuleDefinition rule) {
        this.ruleName = RuleSupport.requireName(rule);
        this.windowMinutes = RuleSupport.requireWindow(rule);
        this.thresholdPercent = rule.getThreshold();
        this.severity = RuleSupport.severityOr(rule, Severity.HIGH);
    }

    @Override
    public Optional<Incident> evaluate(MetricSnapshot snapshot, Instant now) {
        Optional<MetricSeries> series = snapshot == null ? Optional.empty() : snapshot.firstSeries();
        if (series.isEmpty()) {
            LOG.trace("Rule [{}]: no CPU series in snapshot - skipping", ruleName);
            return Optional.empty();
        }

        OptionalDouble average = WindowAverager.recentAverage(series.get(), windowMinutes, now);
        if (average.isEmpty()) {
            LOG.trace("Rule [{}]: no CPU samples in the last {} minutes", ruleName, windowMinutes);
            return Optional.empty();
        }

        double cpu = average.getAsDouble();
        if (!(cpu >= thresholdPercent)) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: cpu={} >= threshold={}", ruleName, cpu, thresholdPercent);
        return Optional.of(Incident.builder()
                .type(IncidentType.HIGH_CPU)
                .resourceId(RuleSupport.resourceOf(series.get(), snapshot))
                .timestamp(now)
                .severity(severity)
                .details("Average CPU usage (" + RuleSupport.value(cpu) + "%) exceeded threshold ("
                        + RuleSupport.threshold(thresholdPercent) + "%) for the last "
                        + windowMinutes + " minutes.")
                .build());
    }

    @Override
    public MetricKind getMetricKind() {
        return MetricKind.CPU;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
