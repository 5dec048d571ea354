/**
 * Configuration loading and validation for Incident Sentinel rules.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.incidentsentinel.core.config.RulesLoader} into a
 * {@link com.incidentsentinel.core.config.RulesConfig} instance. Validation
 * is performed automatically after parsing to ensure fail-fast behaviour.
 * </p>
 *
 * @since 1.0.0
 */
package com.incidentsentinel.core.config;
