package com.incidentsentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single incident rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code cpu} - fires when average CPU percentage reaches the
 * threshold</li>
 * <li>{@code memory} - fires when average available memory (GiB) drops to
 * the threshold</li>
 * <li>{@code network} - fires when combined in+out traffic (KB/s) reaches the
 * threshold</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all fields are present and legal.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    /** Unique rule name used in logs and metrics. */
    private String name;

    /** Rule type: "cpu", "memory" or "network". */
    private String type;

    /** Threshold in the rule's unit: percent, GiB or KB/s. */
    private double threshold;

    /** Trailing window, in minutes, over which the average is taken. */
    private int windowMinutes = 5;

    /** Severity label; empty means the rule type's default. */
    private String severity;

    /**
     * Validate that all required fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule 'type' is required");
        } else {
            try {
                MetricKind.fromName(type);
            } catch (IllegalArgumentException e) {
                errors.add("Unknown rule type: '" + type + "'. Supported: cpu, memory, network");
            }
        }
        if (windowMinutes <= 0) {
            errors.add("Rule '" + name + "' requires 'windowMinutes' > 0");
        }
        if (threshold < 0 || Double.isNaN(threshold)) {
            errors.add("Rule '" + name + "' requires 'threshold' >= 0");
        }
        if (severity != null && !severity.isBlank()) {
            try {
                Severity.fromLabel(severity);
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + name + "' has unknown severity '" + severity + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RuleDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.toLowerCase(Locale.ROOT) : null;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowMinutes() {
        return windowMinutes;
    }

    public void setWindowMinutes(int windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleDefinition that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "RuleDefinition{" +
                "name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", threshold=" + threshold +
                ", windowMinutes=" + windowMinutes +
                ", severity='" + severity + '\'' +
                '}';
    }
}
