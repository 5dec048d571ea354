package com.incidentsentinel.service;

import com.incidentsentinel.core.config.RulesLoader;
import com.incidentsentinel.core.detection.DetectionEngine;
import com.incidentsentinel.core.detection.IncidentRule;
import com.incidentsentinel.core.detection.RuleFactory;
import com.incidentsentinel.core.model.RuleDefinition;
import com.incidentsentinel.core.spi.IncidentStore;
import com.incidentsentinel.core.spi.MetricsSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for the Incident Sentinel service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   ServiceConfig (env) + rules.yml
 *     → FileMetricsSource, JsonLinesIncidentStore
 *     → DetectionEngine (rules from RuleFactory)
 *     → DetectionScheduler (fixed-rate cycles)
 *     → ApiServer (health, incidents, metrics)
 * </pre>
 *
 * <p>
 * All configuration is resolved from environment variables via
 * {@link ServiceConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentSentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentSentinelApp.class);

    private IncidentSentinelApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Incident Sentinel with config: {}", config);

        // 2. Load detection rules
        List<RuleDefinition> definitions = RulesLoader.requireRules(config.getRulesConfigPath());
        List<IncidentRule> rules = RuleFactory.createAll(definitions);
        LOG.info("Loaded {} detection rule(s)", rules.size());

        // 3. Collaborators
        Clock clock = Clock.systemUTC();
        MetricsSource metricsSource = new FileMetricsSource(Path.of(config.getMetricsDataDir()), clock);
        IncidentStore incidentStore = new JsonLinesIncidentStore(Path.of(config.getIncidentStorePath()));
        ExecutorService fetchPool = fetchPool(config.getFetchParallelism());
        DetectionEngine engine = new DetectionEngine(metricsSource, incidentStore, rules, clock, fetchPool);

        // 4. Scheduler and API, with shutdown hooks
        DetectionMetrics metrics = new DetectionMetrics(new SimpleMeterRegistry());
        DetectionScheduler scheduler = new DetectionScheduler(engine, metrics,
                config.getResourceId(), config.getLookbackMinutes());
        ApiServer apiServer = new ApiServer(scheduler, incidentStore, metricsSource, config.getResourceId());

        apiServer.start(config.getApiHost(), config.getApiPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            scheduler.stop();
            if (fetchPool != null) {
                fetchPool.shutdownNow();
            }
        }, "sentinel-shutdown"));

        scheduler.start(config.getDetectionIntervalSeconds());

        // 5. Keep the main thread alive; workers are daemons
        Thread.currentThread().join();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * @return a pool for concurrent metric fetches, or {@code null} to fetch
     *         sequentially on the cycle thread
     */
    static ExecutorService fetchPool(int parallelism) {
        if (parallelism <= 1) {
            return null;
        }
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "metrics-fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
