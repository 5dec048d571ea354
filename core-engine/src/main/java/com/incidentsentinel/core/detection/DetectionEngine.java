package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.spi.IncidentStore;
import com.incidentsentinel.core.spi.IncidentStoreException;
import com.incidentsentinel.core.spi.MetricsFetchException;
import com.incidentsentinel.core.spi.MetricsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs detection cycles: fetch, evaluate, collect, persist.
 *
 * <h3>Cycle</h3>
 * <ol>
 * <li>One snapshot is fetched per metric kind that has at least one rule.
 * With a fetch {@link Executor} the fetches run concurrently, otherwise they
 * run on the calling thread. A failed fetch disables only that kind's
 * rules.</li>
 * <li>Rules are evaluated in CPU, MEMORY, NETWORK order (configuration order
 * within a kind).</li>
 * <li>Every incident is appended to the store. A failed append is logged and
 * counted; the remaining incidents are still appended and the failed one
 * stays in the result.</li>
 * </ol>
 *
 * <h3>State</h3>
 * <p>
 * The engine is <strong>stateless</strong> between cycles and holds only
 * immutable configuration, so concurrent cycles (scheduler plus on-demand
 * API) are safe. Repeated breaches produce a new incident every cycle; there
 * is no cross-cycle suppression.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    private final MetricsSource metricsSource;
    private final IncidentStore incidentStore;
    private final Map<MetricKind, List<IncidentRule>> rulesByKind;
    private final Clock clock;
    private final Executor fetchExecutor;

    /**
     * Engine that fetches sequentially on the calling thread.
     */
    public DetectionEngine(MetricsSource metricsSource, IncidentStore incidentStore,
            List<IncidentRule> rules, Clock clock) {
        this(metricsSource, incidentStore, rules, clock, null);
    }

    /**
     * @param metricsSource telemetry collaborator; must not be {@code null}
     * @param incidentStore persistence collaborator; must not be {@code null}
     * @param rules         rules to evaluate; must not be {@code null} or empty
     * @param clock         source of evaluation time; must not be {@code null}
     * @param fetchExecutor executor for concurrent fetches, or {@code null} to
     *                      fetch sequentially
     * @throws IllegalArgumentException if {@code rules} is empty
     */
    public DetectionEngine(MetricsSource metricsSource, IncidentStore incidentStore,
            List<IncidentRule> rules, Clock clock, Executor fetchExecutor) {
        this.metricsSource = Objects.requireNonNull(metricsSource, "MetricsSource must not be null");
        this.incidentStore = Objects.requireNonNull(incidentStore, "IncidentStore must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        Objects.requireNonNull(rules, "Rules list must not be null");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Rules list must not be empty");
        }
        this.fetchExecutor = fetchExecutor;

        Map<MetricKind, List<IncidentRule>> grouped = new EnumMap<>(MetricKind.class);
        for (IncidentRule rule : rules) {
            Objects.requireNonNull(rule, "Rule must not be null");
            grouped.computeIfAbsent(rule.getMetricKind(), k -> new ArrayList<>()).add(rule);
        }
        grouped.replaceAll((kind, list) -> List.copyOf(list));
        this.rulesByKind = Collections.unmodifiableMap(grouped);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run one cycle and return the detected incidents.
     *
     * @param resourceId      the monitored resource
     * @param lookbackMinutes how much telemetry to fetch, in minutes
     * @return every detected incident in CPU, MEMORY, NETWORK order, whether
     *         or not persisting it succeeded
     * @throws IllegalArgumentException if {@code resourceId} is blank or
     *                                  {@code lookbackMinutes} is not positive
     */
    public List<Incident> runDetectionCycle(String resourceId, int lookbackMinutes) {
        return runCycle(resourceId, lookbackMinutes).getIncidents();
    }

    /**
     * Run one cycle and report incidents together with fetch and store
     * failures.
     *
     * @param resourceId      the monitored resource
     * @param lookbackMinutes how much telemetry to fetch, in minutes
     * @return the cycle report
     * @throws IllegalArgumentException if {@code resourceId} is blank or
     *                                  {@code lookbackMinutes} is not positive
     */
    public DetectionReport runCycle(String resourceId, int lookbackMinutes) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be null or blank");
        }
        if (lookbackMinutes <= 0) {
            throw new IllegalArgumentException("lookbackMinutes must be > 0, got: " + lookbackMinutes);
        }
        Instant startedAt = clock.instant();

        // 1. Fetch every needed kind before evaluating anything
        Map<MetricKind, CompletableFuture<MetricSnapshot>> pending = new EnumMap<>(MetricKind.class);
        for (MetricKind kind : rulesByKind.keySet()) {
            pending.put(kind, submitFetch(resourceId, lookbackMinutes, kind));
        }

        Map<MetricKind, MetricSnapshot> snapshots = new EnumMap<>(MetricKind.class);
        Map<MetricKind, String> fetchErrors = new EnumMap<>(MetricKind.class);
        for (Map.Entry<MetricKind, CompletableFuture<MetricSnapshot>> entry : pending.entrySet()) {
            awaitFetch(entry.getKey(), entry.getValue(), snapshots, fetchErrors);
        }

        // 2. Evaluate in kind order
        Instant now = clock.instant();
        List<Incident> incidents = new ArrayList<>();
        for (Map.Entry<MetricKind, MetricSnapshot> entry : snapshots.entrySet()) {
            for (IncidentRule rule : rulesByKind.get(entry.getKey())) {
                evaluate(rule, entry.getValue(), now).ifPresent(incidents::add);
            }
        }

        // 3. Persist, tolerating per-incident failures
        int storeErrors = 0;
        for (Incident incident : incidents) {
            if (!persist(incident)) {
                storeErrors++;
            }
        }

        DetectionReport report = new DetectionReport(resourceId, startedAt, incidents, storeErrors,
                rulesByKind.keySet(), fetchErrors);
        LOG.info("Detection cycle for {} produced {} incident(s) ({} store error(s), {} fetch error(s))",
                resourceId, incidents.size(), storeErrors, fetchErrors.size());
        return report;
    }

    /**
     * @return unmodifiable view of the registered rules grouped by kind
     */
    public Map<MetricKind, List<IncidentRule>> getRulesByKind() {
        return rulesByKind;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private CompletableFuture<MetricSnapshot> submitFetch(String resourceId, int lookbackMinutes,
            MetricKind kind) {
        if (fetchExecutor == null) {
            try {
                return CompletableFuture.completedFuture(fetch(resourceId, lookbackMinutes, kind));
            } catch (MetricsFetchException | RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return fetch(resourceId, lookbackMinutes, kind);
                } catch (MetricsFetchException e) {
                    throw new CompletionException(e);
                }
            }, fetchExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private MetricSnapshot fetch(String resourceId, int lookbackMinutes, MetricKind kind)
            throws MetricsFetchException {
        MetricSnapshot snapshot = metricsSource.fetch(resourceId, lookbackMinutes, kind);
        if (snapshot == null) {
            throw new MetricsFetchException(kind, "Metrics source returned no snapshot");
        }
        return snapshot;
    }

    private static void awaitFetch(MetricKind kind, CompletableFuture<MetricSnapshot> future,
            Map<MetricKind, MetricSnapshot> snapshots, Map<MetricKind, String> fetchErrors) {
        try {
            snapshots.put(kind, future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Fetch of {} metrics failed - skipping its rules: {}", kind, cause.getMessage(), cause);
            fetchErrors.put(kind, String.valueOf(cause.getMessage()));
        } catch (CancellationException e) {
            LOG.warn("Fetch of {} metrics was cancelled - skipping its rules", kind);
            fetchErrors.put(kind, "cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted while fetching {} metrics - skipping its rules", kind);
            fetchErrors.put(kind, "interrupted");
        }
    }

    private static Optional<Incident> evaluate(IncidentRule rule, MetricSnapshot snapshot, Instant now) {
        try {
            Optional<Incident> incident = rule.evaluate(snapshot, now);
            incident.ifPresent(i -> LOG.info("Incident detected: rule={} type={} severity={}",
                    rule.getRuleName(), i.getType().getDisplayName(), i.getSeverity().getLabel()));
            return incident;
        } catch (RuntimeException e) {
            LOG.error("Rule [{}] threw an exception - continuing with next rule", rule.getRuleName(), e);
            return Optional.empty();
        }
    }

    private boolean persist(Incident incident) {
        try {
            incidentStore.append(incident);
            return true;
        } catch (IncidentStoreException | RuntimeException e) {
            LOG.warn("Failed to store incident {} for {}: {}",
                    incident.getType().getDisplayName(), incident.getResourceId(), e.getMessage(), e);
            return false;
        }
    }
}
