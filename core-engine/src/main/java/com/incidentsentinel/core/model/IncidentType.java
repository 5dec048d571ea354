package com.incidentsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of incident raised by a rule.
 *
 * <p>
 * The display name is what gets persisted and shown to operators; stored
 * records are read back by display name.
 * </p>
 */
public enum IncidentType {

    HIGH_CPU("High CPU Utilization"),
    LOW_MEMORY("Low Available Memory"),
    HIGH_NETWORK("High Network Traffic");

    private final String displayName;

    IncidentType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a type from its display name or constant name.
     *
     * @param value e.g. {@code High CPU Utilization} or {@code HIGH_CPU}
     * @return matching type
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static IncidentType fromDisplayName(String value) {
        if (value != null) {
            for (IncidentType type : values()) {
                if (type.displayName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown incident type: '" + value + "'");
    }
}
