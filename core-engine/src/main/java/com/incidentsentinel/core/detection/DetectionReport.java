package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.MetricKind;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one detection cycle.
 *
 * <p>
 * {@link #getIncidents()} holds every detected incident in evaluation order,
 * whether or not it was persisted. Persistence and fetch problems are
 * reported alongside instead of being thrown.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionReport {

    private final String resourceId;
    private final Instant startedAt;
    private final List<Incident> incidents;
    private final int storeErrorCount;
    private final Set<MetricKind> attemptedKinds;
    private final Map<MetricKind, String> fetchErrors;

    DetectionReport(String resourceId, Instant startedAt, List<Incident> incidents,
            int storeErrorCount, Set<MetricKind> attemptedKinds, Map<MetricKind, String> fetchErrors) {
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.incidents = List.copyOf(incidents);
        this.storeErrorCount = storeErrorCount;
        this.attemptedKinds = attemptedKinds.isEmpty()
                ? EnumSet.noneOf(MetricKind.class)
                : EnumSet.copyOf(attemptedKinds);
        this.fetchErrors = fetchErrors.isEmpty()
                ? new EnumMap<>(MetricKind.class)
                : new EnumMap<>(fetchErrors);
    }

    public String getResourceId() {
        return resourceId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    /**
     * @return unmodifiable, order-preserved list of detected incidents
     */
    public List<Incident> getIncidents() {
        return incidents;
    }

    /**
     * @return number of incidents the store failed to append
     */
    public int getStoreErrorCount() {
        return storeErrorCount;
    }

    /**
     * @return metric kinds that were fetched this cycle
     */
    public Set<MetricKind> getAttemptedKinds() {
        return Collections.unmodifiableSet(attemptedKinds);
    }

    /**
     * @return failure message per metric kind whose fetch failed
     */
    public Map<MetricKind, String> getFetchErrors() {
        return Collections.unmodifiableMap(fetchErrors);
    }

    public boolean hasFetchErrors() {
        return !fetchErrors.isEmpty();
    }

    /**
     * A cycle with no incidents because nothing could be fetched is not a
     * healthy cycle; callers should surface it as unavailable.
     *
     * @return {@code true} if at least one fetch was attempted and all failed
     */
    public boolean isFetchFailedEntirely() {
        return !attemptedKinds.isEmpty() && fetchErrors.keySet().containsAll(attemptedKinds);
    }

    @Override
    public String toString() {
        return "DetectionReport{" +
                "resourceId='" + resourceId + '\'' +
                ", startedAt=" + startedAt +
                ", incidents=" + incidents.size() +
                ", storeErrorCount=" + storeErrorCount +
                ", fetchErrors=" + fetchErrors.keySet() +
                '}';
    }
}
