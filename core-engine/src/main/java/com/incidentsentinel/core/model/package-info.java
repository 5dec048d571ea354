/**
 * Domain model classes for Incident Sentinel.
 *
 * <p>
 * This package contains the types shared between the detection engine and
 * the monitor service:
 * </p>
 * <ul>
 * <li>{@link com.incidentsentinel.core.model.MetricPoint},
 * {@link com.incidentsentinel.core.model.MetricSeries} and
 * {@link com.incidentsentinel.core.model.MetricSnapshot} - normalized
 * telemetry</li>
 * <li>{@link com.incidentsentinel.core.model.Incident} - record emitted when a
 * rule fires</li>
 * <li>{@link com.incidentsentinel.core.model.RuleDefinition} - rule
 * configuration POJO</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.incidentsentinel.core.model;
