package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricSnapshot;

import java.time.Instant;
import java.util.Optional;

/**
 * Contract for all incident rules.
 * <p>
 * Implementations are <strong>stateless</strong>: the outcome depends only on
 * the snapshot and the evaluation instant, so one instance can be shared by
 * concurrent detection cycles.
 * </p>
 * <p>
 * A rule never throws on missing or malformed telemetry. Insufficient data
 * yields {@link Optional#empty()}.
 * </p>
 */
public interface IncidentRule {

    /**
     * Evaluate a snapshot and decide whether it constitutes an incident.
     *
     * @param snapshot telemetry of this rule's {@link #getMetricKind() kind}
     * @param now      evaluation instant; becomes the incident timestamp
     * @return an {@link Incident} if the rule fires, empty otherwise
     */
    Optional<Incident> evaluate(MetricSnapshot snapshot, Instant now);

    /**
     * @return which snapshot this rule consumes
     */
    MetricKind getMetricKind();

    /**
     * Return the unique name of this rule.
     *
     * @return rule name
     */
    String getRuleName();
}
