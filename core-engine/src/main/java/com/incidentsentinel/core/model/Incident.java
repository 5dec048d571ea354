package com.incidentsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one rule firing once during one detection cycle.
 *
 * <p>
 * Incidents are immutable. They are created by incident rules at evaluation
 * time, handed to the incident store for durable append and never updated
 * afterwards.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. It enforces that {@code type}, {@code resourceId},
 * {@code timestamp} and {@code severity} are present; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * <h3>JSON</h3>
 * <p>
 * Serialized with snake_case keys ({@code incident_type}, {@code resource_id},
 * {@code timestamp}, {@code details}, {@code severity}); this is the stored
 * record format and the shape returned by the HTTP API.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "incident_type", "resource_id", "timestamp", "details", "severity" })
public final class Incident {

    /** Which rule condition was breached. */
    private final IncidentType type;

    /** Resource the breach was measured on. */
    private final String resourceId;

    /** Time of evaluation, not of the breach itself. */
    private final Instant timestamp;

    /** Human-readable description with measured value, threshold and window. */
    private final String details;

    private final Severity severity;

    private Incident(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.resourceId = Objects.requireNonNull(builder.resourceId, "resourceId must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.details = builder.details;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
    }

    @JsonCreator
    static Incident fromJson(@JsonProperty("incident_type") IncidentType type,
            @JsonProperty("resource_id") String resourceId,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("details") String details,
            @JsonProperty("severity") Severity severity) {
        return builder()
                .type(type)
                .resourceId(resourceId)
                .timestamp(timestamp)
                .details(details)
                .severity(severity)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Incident} instances.
     */
    public static class Builder {
        private IncidentType type;
        private String resourceId;
        private Instant timestamp;
        private String details;
        private Severity severity;

        public Builder type(IncidentType type) {
            this.type = type;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * Build the incident.
         *
         * @return a new {@link Incident}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Incident build() {
            return new Incident(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    @JsonProperty("incident_type")
    public IncidentType getType() {
        return type;
    }

    @JsonProperty("resource_id")
    public String getResourceId() {
        return resourceId;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("details")
    public String getDetails() {
        return details;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Incident that))
            return false;
        return type == that.type
                && resourceId.equals(that.resourceId)
                && timestamp.equals(that.timestamp)
                && Objects.equals(details, that.details)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, resourceId, timestamp, details, severity);
    }

    @Override
    public String toString() {
        return "Incident{" +
                "type=" + type +
                ", resourceId='" + resourceId + '\'' +
                ", timestamp=" + timestamp +
                ", severity=" + severity +
                ", details='" + details + '\'' +
                '}';
    }
}
