/**
 * Collaborator contracts the detection engine depends on.
 *
 * <p>
 * {@link com.incidentsentinel.core.spi.MetricsSource} and
 * {@link com.incidentsentinel.core.spi.IncidentStore} are implemented outside
 * the core (cloud SDK, document store, file) and injected into the
 * {@link com.incidentsentinel.core.detection.DetectionEngine}.
 * </p>
 *
 * @since 1.0.0
 */
package com.incidentsentinel.core.spi;
