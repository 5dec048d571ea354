package com.incidentsentinel.core.detection;

import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.model.IncidentType;
import com.incidentsentinel.core.model.MetricKind;
import com.incidentsentinel.core.model.MetricSnapshot;
import com.incidentsentinel.core.model.Severity;
import com.incidentsentinel.core.spi.IncidentStore;
import com.incidentsentinel.core.spi.IncidentStoreException;
import com.incidentsentinel.core.spi.MetricsFetchException;
import com.incidentsentinel.core.spi.MetricsSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.incidentsentinel.core.detection.Snapshots.GIB;
import static com.incidentsentinel.core.detection.Snapshots.NOW;
import static com.incidentsentinel.core.detection.Snapshots.RESOURCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionEngine}.
 */
class DetectionEngineTest {

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private FakeMetricsSource source;
    private RecordingIncidentStore store;
    private DetectionEngine engine;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        source = new FakeMetricsSource();
        store = new RecordingIncidentStore();
        engine = new DetectionEngine(source, store, Snapshots.defaultRules(), clock);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should return nothing and append nothing when no rule fires")
    void shouldReturnEmptyWhenQuiet() {
        source.healthy();

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).isEmpty();
        assertThat(store.appended).isEmpty();
        assertThat(report.getStoreErrorCount()).isZero();
        assertThat(report.hasFetchErrors()).isFalse();
        assertThat(report.isFetchFailedEntirely()).isFalse();
    }

    @Test
    @DisplayName("Should append once per incident in CPU, memory, network order")
    void shouldDetectAllInOrder() {
        source.breaching();

        List<Incident> incidents = engine.runDetectionCycle(RESOURCE, 10);

        assertThat(incidents).extracting(Incident::getType)
                .containsExactly(IncidentType.HIGH_CPU, IncidentType.LOW_MEMORY, IncidentType.HIGH_NETWORK);
        assertThat(incidents).extracting(Incident::getSeverity)
                .containsExactly(Severity.HIGH, Severity.HIGH, Severity.MEDIUM);
        assertThat(incidents).allSatisfy(i -> assertThat(i.getTimestamp()).isEqualTo(NOW));
        assertThat(store.appended).containsExactlyElementsOf(incidents);
    }

    @Test
    @DisplayName("Should pass resource id and lookback to the metrics source for every kind")
    void shouldFetchEveryKind() {
        source.healthy();

        engine.runCycle(RESOURCE, 10);

        assertThat(source.requestedKinds).containsExactlyInAnyOrder(MetricKind.values());
        assertThat(source.requestedWindows).containsOnly(10);
        assertThat(source.requestedResources).containsOnly(RESOURCE);
    }

    @Test
    @DisplayName("Should keep every incident when one append fails and count the store error")
    void shouldTolerateStoreFailure() {
        source.breaching();
        store.failOn = EnumSet.of(IncidentType.HIGH_CPU);

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).hasSize(3);
        assertThat(report.getStoreErrorCount()).isEqualTo(1);
        assertThat(store.appended).extracting(Incident::getType)
                .containsExactly(IncidentType.LOW_MEMORY, IncidentType.HIGH_NETWORK);
        assertThat(store.attempts).isEqualTo(3);
    }

    @Test
    @DisplayName("Should treat a runtime store failure like a store error")
    void shouldTolerateRuntimeStoreFailure() {
        source.breaching();
        store.runtimeFailure = true;

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).hasSize(3);
        assertThat(report.getStoreErrorCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should skip only the rules of a kind whose fetch failed")
    void shouldIsolateFetchFailure() {
        source.breaching();
        source.failures.put(MetricKind.MEMORY, new MetricsFetchException(MetricKind.MEMORY, "quota exceeded"));

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).extracting(Incident::getType)
                .containsExactly(IncidentType.HIGH_CPU, IncidentType.HIGH_NETWORK);
        assertThat(report.getFetchErrors()).containsOnlyKeys(MetricKind.MEMORY);
        assertThat(report.getFetchErrors().get(MetricKind.MEMORY)).contains("quota exceeded");
        assertThat(report.isFetchFailedEntirely()).isFalse();
    }

    @Test
    @DisplayName("Should report a wholly failed cycle when every fetch fails")
    void shouldReportTotalFetchFailure() {
        for (MetricKind kind : MetricKind.values()) {
            source.failures.put(kind, new MetricsFetchException(kind, "auth failed"));
        }

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).isEmpty();
        assertThat(report.isFetchFailedEntirely()).isTrue();
        assertThat(store.attempts).isZero();
    }

    @Test
    @DisplayName("Should record a runtime exception or null snapshot from the source as a fetch error")
    void shouldTreatUnexpectedSourceBehaviourAsFetchError() {
        source.breaching();
        source.runtimeFailures.add(MetricKind.CPU);
        source.snapshots.remove(MetricKind.NETWORK);

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).extracting(Incident::getType)
                .containsExactly(IncidentType.LOW_MEMORY);
        assertThat(report.getFetchErrors()).containsOnlyKeys(MetricKind.CPU, MetricKind.NETWORK);
    }

    @Test
    @DisplayName("Should continue when a rule throws unexpectedly")
    void shouldContinueWhenRuleThrows() {
        IncidentRule exploding = new IncidentRule() {
            @Override
            public Optional<Incident> evaluate(MetricSnapshot snapshot, Instant now) {
                throw new IllegalStateException("boom");
            }

            @Override
            public MetricKind getMetricKind() {
                return MetricKind.CPU;
            }

            @Override
            public String getRuleName() {
                return "exploding";
            }
        };
        List<IncidentRule> rules = new ArrayList<>();
        rules.add(exploding);
        rules.addAll(Snapshots.defaultRules());
        engine = new DetectionEngine(source, store, rules, clock);
        source.breaching();

        assertThat(engine.runDetectionCycle(RESOURCE, 10)).hasSize(3);
    }

    @Test
    @DisplayName("Should only fetch kinds that have rules")
    void shouldFetchOnlyConfiguredKinds() {
        engine = new DetectionEngine(source, store,
                RuleFactory.createAll(List.of(Snapshots.rule("cpu_only", "cpu", 80))), clock);
        source.breaching();

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(source.requestedKinds).containsExactly(MetricKind.CPU);
        assertThat(report.getAttemptedKinds()).containsExactly(MetricKind.CPU);
        assertThat(report.getIncidents()).hasSize(1);
    }

    @Test
    @DisplayName("Should produce the same ordered result when fetching concurrently")
    void shouldFetchConcurrently() {
        executor = Executors.newFixedThreadPool(3);
        engine = new DetectionEngine(source, store, Snapshots.defaultRules(), clock, executor);
        source.breaching();
        source.failures.put(MetricKind.NETWORK, new MetricsFetchException(MetricKind.NETWORK, "timeout"));

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).extracting(Incident::getType)
                .containsExactly(IncidentType.HIGH_CPU, IncidentType.LOW_MEMORY);
        assertThat(report.getFetchErrors()).containsOnlyKeys(MetricKind.NETWORK);
    }

    @Test
    @DisplayName("Should record fetch errors instead of failing when the fetch pool is shut down")
    void shouldTreatRejectedFetchAsFetchError() {
        executor = Executors.newFixedThreadPool(2);
        engine = new DetectionEngine(source, store, Snapshots.defaultRules(), clock, executor);
        source.breaching();
        executor.shutdownNow();

        DetectionReport report = engine.runCycle(RESOURCE, 10);

        assertThat(report.getIncidents()).isEmpty();
        assertThat(report.isFetchFailedEntirely()).isTrue();
        assertThat(report.getFetchErrors()).containsOnlyKeys(MetricKind.values());
        assertThat(source.requestedKinds).isEmpty();
        assertThat(store.attempts).isZero();
    }

    @Test
    @DisplayName("Should raise no incident for samples whose average is NaN")
    void shouldIgnoreNanSamples() {
        source.breaching();
        source.snapshots.put(MetricKind.CPU, Snapshots.cpu(Double.NaN));
        source.snapshots.put(MetricKind.MEMORY, Snapshots.memory(Double.NaN));

        assertThat(engine.runDetectionCycle(RESOURCE, 10)).extracting(Incident::getType)
                .containsExactly(IncidentType.HIGH_NETWORK);
    }

    @Test
    @DisplayName("Should produce a duplicate incident on the next cycle for a persisting breach")
    void shouldNotDeduplicateAcrossCycles() {
        source.breaching();

        engine.runCycle(RESOURCE, 10);
        engine.runCycle(RESOURCE, 10);

        assertThat(store.appended).hasSize(6);
    }

    @Test
    @DisplayName("Should reject invalid arguments before calling collaborators")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> engine.runCycle(RESOURCE, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookbackMinutes");
        assertThatThrownBy(() -> engine.runCycle(" ", 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(source.requestedKinds).isEmpty();
    }

    @Test
    @DisplayName("Should refuse to build without rules")
    void shouldRequireRules() {
        assertThatThrownBy(() -> new DetectionEngine(source, store, List.of(), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Fakes
    // ------------------------------------------------------------------

    private static final class FakeMetricsSource implements MetricsSource {
        final Map<MetricKind, MetricSnapshot> snapshots = new EnumMap<>(MetricKind.class);
        final Map<MetricKind, MetricsFetchException> failures = new EnumMap<>(MetricKind.class);
        final Set<MetricKind> runtimeFailures = EnumSet.noneOf(MetricKind.class);
        final List<MetricKind> requestedKinds = Collections.synchronizedList(new ArrayList<>());
        final List<Integer> requestedWindows = Collections.synchronizedList(new ArrayList<>());
        final List<String> requestedResources = Collections.synchronizedList(new ArrayList<>());

        void healthy() {
            snapshots.put(MetricKind.CPU, Snapshots.cpu(20.0));
            snapshots.put(MetricKind.MEMORY, Snapshots.memory(6.0 * GIB));
            snapshots.put(MetricKind.NETWORK, Snapshots.network(10 * 1024.0, 5 * 1024.0));
        }

        void breaching() {
            snapshots.put(MetricKind.CPU, Snapshots.cpu(85.0));
            snapshots.put(MetricKind.MEMORY, Snapshots.memory(1.5 * GIB));
            snapshots.put(MetricKind.NETWORK, Snapshots.network(60 * 1024.0, 50 * 1024.0));
        }

        @Override
        public MetricSnapshot fetch(String resourceId, int windowMinutes, MetricKind kind)
                throws MetricsFetchException {
            requestedKinds.add(kind);
            requestedWindows.add(windowMinutes);
            requestedResources.add(resourceId);
            if (failures.containsKey(kind)) {
                throw failures.get(kind);
            }
            if (runtimeFailures.contains(kind)) {
                throw new IllegalStateException("connection reset");
            }
            return snapshots.get(kind);
        }
    }

    private static final class RecordingIncidentStore implements IncidentStore {
        final List<Incident> appended = new ArrayList<>();
        Set<IncidentType> failOn = EnumSet.noneOf(IncidentType.class);
        boolean runtimeFailure;
        int attempts;

        @Override
        public synchronized void append(Incident incident) throws IncidentStoreException {
            attempts++;
            if (runtimeFailure) {
                throw new IllegalStateException("store offline");
            }
            if (failOn.contains(incident.getType())) {
                throw new IncidentStoreException("write rejected");
            }
            appended.add(incident);
        }

        @Override
        public List<Incident> listAll() {
            return List.copyOf(appended);
        }
    }
}
