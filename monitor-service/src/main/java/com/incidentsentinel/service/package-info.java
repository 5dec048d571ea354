/**
 * Runnable Incident Sentinel service.
 *
 * <p>
 * This package wires the core detection engine to file-backed metrics and
 * incident storage, runs detection on a schedule, and serves the results
 * over HTTP.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.incidentsentinel.service.IncidentSentinelApp} – main entry
 * point</li>
 * <li>{@link com.incidentsentinel.service.ServiceConfig} – environment-driven
 * configuration</li>
 * <li>{@link com.incidentsentinel.service.DetectionScheduler} – fixed-rate
 * detection cycles</li>
 * <li>{@link com.incidentsentinel.service.ApiServer} – HTTP endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.incidentsentinel.service;
