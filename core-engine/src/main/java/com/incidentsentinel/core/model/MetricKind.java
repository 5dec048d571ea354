package com.incidentsentinel.core.model;

import java.util.Locale;

/**
 * Category of telemetry fetched in one call.
 *
 * <p>
 * Declaration order is the evaluation order of a detection cycle.
 * </p>
 */
public enum MetricKind {

    CPU,
    MEMORY,
    NETWORK;

    /**
     * @return lowercase name used in configuration files and URLs
     */
    public String pathName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a case-insensitive kind name.
     *
     * @param value kind name such as {@code cpu}
     * @return matching kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static MetricKind fromName(String value) {
        if (value != null) {
            for (MetricKind kind : values()) {
                if (kind.name().equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric kind: '" + value
                + "'. Supported: cpu, memory, network");
    }
}
