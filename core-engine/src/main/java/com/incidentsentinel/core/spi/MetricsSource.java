package com.incidentsentinel.core.spi;

import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricSnapshot;

/**
 * Supplies telemetry for one resource.
 *
 * <p>
 * Implementations wrap a vendor query API and are responsible for
 * normalizing its response (plain string series names, populated
 * {@code average} fields) before the engine sees it. They carry their own
 * timeouts.
 * </p>
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Fetch every series of the given kind covering the trailing window.
     *
     * @param resourceId    the monitored resource
     * @param windowMinutes how far back to query, in minutes
     * @param kind          which telemetry to fetch
     * @return a snapshot, possibly with series that contain no points
     * @throws MetricsFetchException on transport, auth or quota failure; an
     *                               implementation must never report a failed
     *                               fetch as an empty snapshot
     */
    MetricSnapshot fetch(String resourceId, int windowMinutes, MetricKind kind)
            throws MetricsFetchException;
}
