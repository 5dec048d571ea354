/**
 * Incident detection engine.
 *
 * <p>
 * All rules implement the
 * {@link com.incidentsentinel.core.detection.IncidentRule} interface and are
 * instantiated via {@link com.incidentsentinel.core.detection.RuleFactory}.
 * Built-in rule types:
 * </p>
 * <ul>
 * <li>{@link com.incidentsentinel.core.detection.CpuUtilizationRule} - average
 * CPU at or above a percentage</li>
 * <li>{@link com.incidentsentinel.core.detection.AvailableMemoryRule} -
 * average available memory at or below a GiB amount</li>
 * <li>{@link com.incidentsentinel.core.detection.NetworkTrafficRule} -
 * combined in+out traffic at or above a KB/s rate</li>
 * </ul>
 *
 * <p>
 * {@link com.incidentsentinel.core.detection.DetectionEngine} runs them
 * against snapshots fetched from a
 * {@link com.incidentsentinel.core.spi.MetricsSource}, using
 * {@link com.incidentsentinel.core.detection.WindowAverager} for the trailing
 * window math.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule type, implement {@code IncidentRule} and register the
 * type string in {@code RuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.incidentsentinel.core.detection;
