package com.incidentsentinel.core.spi;

import com.incidentsentinel.core.model.MetricKind;

/**
 * Thrown when a {@link MetricsSource} cannot produce a snapshot.
 */
public class MetricsFetchException extends Exception {

    private static final long serialVersionUID = 1L;

    private final MetricKind kind;

    public MetricsFetchException(MetricKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetricsFetchException(MetricKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return the metric kind whose fetch failed
     */
    public MetricKind getKind() {
        return kind;
    }
}
