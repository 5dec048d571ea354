package com.incidentsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Incident severity, ordered from least to most severe.
 */
public enum Severity {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    /**
     * @return display label, also used as the JSON value
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse a severity from its label or constant name, ignoring case.
     *
     * @param value e.g. {@code High} or {@code high}
     * @return matching severity
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static Severity fromLabel(String value) {
        if (value != null) {
            for (Severity severity : values()) {
                if (severity.label.equalsIgnoreCase(value.trim())) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + value
                + "'. Supported: low, medium, high");
    }
}
