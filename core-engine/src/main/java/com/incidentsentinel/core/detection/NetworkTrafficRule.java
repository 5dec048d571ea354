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
 * High combined network traffic rule.
 *
 * <p>
 * Needs both the {@value #NETWORK_IN} and {@value #NETWORK_OUT} series. Each
 * is averaged on its own, converted from bytes/s to KB/s, and the two are
 * summed; the rule fires when the sum is at or above the threshold. Missing
 * either direction means "no incident": absent data is not itself an anomaly.
 * Default severity is {@link Severity#MEDIUM}.
 * </p>
 *
 * @since 1.0.0
 */
public class NetworkTrafficRule implements IncidentRule {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkTrafficRule.class);

    public static final String NETWORK_IN = "Network In Total";
    public static final String NETWORK_OUT = "Network Out Total";

    private final String ruleName;
    private final double thresholdKbps;
    private final int windowMinutes;
    private final Severity severity;

    /**
     * @param rule the rule configuration; threshold is in KB/s
     */
    public NetworkTrafficRule(RuleDefinition rule) {
        this.ruleName = RuleSupport.requireName(rule);
        this.windowMinutes = RuleSupport.requireWindow(rule);
        this.thresholdKbps = rule.getThreshold();
        this.severity = RuleSupport.severityOr(rule, Severity.MEDIUM);
    }

    @Override
    public Optional<Incident> evaluate(MetricSnapshot snapshot, Instant now) {
        if (snapshot == null) {
            return Optional.empty();
        }
        Optional<MetricSeries> in = snapshot.seriesNamed(NETWORK_IN);
        Optional<MetricSeries> out = snapshot.seriesNamed(NETWORK_OUT);
        if (in.isEmpty() || out.isEmpty()) {
            LOG.trace("Rule [{}]: network in/out series missing - skipping", ruleName);
            return Optional.empty();
        }

        OptionalDouble inBytes = WindowAverager.recentAverage(in.get(), windowMinutes, now);
        OptionalDouble outBytes = WindowAverager.recentAverage(out.get(), windowMinutes, now);
        if (inBytes.isEmpty() || outBytes.isEmpty()) {
            LOG.trace("Rule [{}]: insufficient network samples in the last {} minutes",
                    ruleName, windowMinutes);
            return Optional.empty();
        }

        double inKbps = inBytes.getAsDouble() / RuleSupport.BYTES_PER_KB;
        double outKbps = outBytes.getAsDouble() / RuleSupport.BYTES_PER_KB;
        double totalKbps = inKbps + outKbps;
        if (!(totalKbps >= thresholdKbps)) {
            return Optional.empty();
        }

        LOG.debug("Rule [{}] fired: totalKbps={} >= threshold={}", ruleName, totalKbps, thresholdKbps);
        return Optional.of(Incident.builder()
                .type(IncidentType.HIGH_NETWORK)
                .resourceId(RuleSupport.resourceOf(in.get(), snapshot))
                .timestamp(now)
                .severity(severity)
                .details("Average total network traffic (" + RuleSupport.value(totalKbps)
                        + " KBps) exceeded threshold (" + RuleSupport.threshold(thresholdKbps)
                        + " KBps) for the last " + windowMinutes + " minutes. (In: "
                        + RuleSupport.value(inKbps) + " KBps, Out: "
                        + RuleSupport.value(outKbps) + " KBps)")
                .build());
    }

    @Override
    public MetricKind getMetricKind() {
        return MetricKind.NETWORK;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
