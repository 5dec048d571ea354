package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.MetricSeries;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.model.RuleDefinition;
import com.incidentsentinel.core.model.Severity;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Helpers shared by the built-in rules.
 */
final class RuleSupport {

    static final double BYTES_PER_GIB = 1024.0 * 1024.0 * 1024.0;
    static final double BYTES_PER_KB = 1024.0;

    private RuleSupport() {
    }

    /** Measured values always render with two decimals. */
    static String value(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    /**
     * Thresholds render in plain decimal notation with at least one
     * fractional digit, e.g. {@code 80.0}, {@code 2.5}, {@code 10000000.0}
     * or {@code 0.0001}.
     */
    static String threshold(double t) {
        if (!Double.isFinite(t)) {
            return Double.toString(t);
        }
        String plain = BigDecimal.valueOf(t).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /** Incidents carry the series' resource id, falling back to the snapshot's. */
    static String resourceOf(MetricSeries series, MetricSnapshot snapshot) {
        return series.getResourceId() != null ? series.getResourceId() : snapshot.getResourceId();
    }

    static String requireName(RuleDefinition rule) {
        Objects.requireNonNull(rule, "RuleDefinition must not be null");
        return Objects.requireNonNull(rule.getName(), "Rule name must not be null");
    }

    static int requireWindow(RuleDefinition rule) {
        if (rule.getWindowMinutes() <= 0) {
            throw new IllegalArgumentException("windowMinutes must be > 0 for rule '"
                    + rule.getName() + "', got: " + rule.getWindowMinutes());
        }
        return rule.getWindowMinutes();
    }

    static Severity severityOr(RuleDefinition rule, Severity fallback) {
        String label = rule.getSeverity();
        return label == null || label.isBlank() ? fallback : Severity.fromLabel(label);
    }
}
