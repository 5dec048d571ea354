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
 * Low available memory rule.
 *
 * <p>
 * The memory series is reported in bytes; the trailing average is converted
 * to GiB and the rule fires when it is at or <em>below</em> the threshold.
 * The comparator is inverted relative to the CPU and network rules because a
 * low value is the incident condition.
 * </p>
 *
 * @since 1.0.0
 */
public class AvailableMemoryRule implements IncidentRule {

    private static final Logger LOG = LoggerFactory.getLogger(AvailableMemoryRule.class);

    private final String ruleName;
    private final double thresholdGib;
    private final int windowMinutes;
    private final Severity severity;

    /**
     * @param rule the rule configuration; threshold is in GiB
     */
    public AvailableMemoryRule(RuleDefinition rule) {
        this.ruleName = RuleSupport.requireName(rule);
        this.windowMinutes = RuleSupport.requireWindow(rule);
        this.thresholdGib = rule.getThreshold();
        this.severity = RuleSupport.severityOr(rule, Severity.HIGH);
    }

    @Override
    public Optional<Incident> evaluate(MetricSnapshot snapshot, Instant now) {
        Optional<MetricSeries> series = snapshot == null ? Optional.empty() : snapshot.firstSeries();
        if (series.isEmpty()) {
            LOG.trace("Rule [{}]: no memory series in snapshot - skipping", ruleName);
            return Optional.empty();
        }

        OptionalDouble averageBytes = WindowAverager.recentAverage(series.get(), windowMinutes, now);
        if (averageBytes.isEmpty()) {
            LOG.trace("Rule [{}]: no memory samples in the last {} minutes", ruleName, windowMinutes);
            return Optional.empty();
        }

        double availableGib = averageBytes.getAsDouble() / RuleSupport.BYTES_PER_GIB;
        if (!(availableGib <= thresholdGib)) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: availableGib={} <= threshold={}", ruleName, availableGib, thresholdGib);
        return Optional.of(Incident.builder()
                .type(IncidentType.LOW_MEMORY)
                .resourceId(RuleSupport.resourceOf(series.get(), snapshot))
                .timestamp(now)
                .severity(severity)
                .details("Average available memory (" + RuleSupport.value(availableGib)
                        + " GB) fell below threshold (" + RuleSupport.threshold(thresholdGib)
                        + " GB) for the last " + windowMinutes + " minutes.")
                .build());
    }

    @Override
    public MetricKind getMetricKind() {
        return MetricKind.MEMORY;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
