package com.incidentsentinel.service;

import com.incidentsentinel.core.detection.DetectionEngine;
import com.incidentsentinel.core.detection.DetectionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs detection cycles for one resource at a fixed rate.
 *
 * <p>
 * Cycles run on a single daemon thread. A failing cycle is logged and the
 * schedule carries on. {@link #runCycleNow()} runs a cycle on the calling
 * thread and is what the API's on-demand endpoint uses; both paths feed the
 * same {@link DetectionMetrics}.
 * </p>
 */
public class DetectionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionScheduler.class);

    private final DetectionEngine engine;
    private final DetectionMetrics metrics;
    private final String resourceId;
    private final int lookbackMinutes;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService executor;

    public DetectionScheduler(DetectionEngine engine, DetectionMetrics metrics,
            String resourceId, int lookbackMinutes) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId must not be null");
        this.lookbackMinutes = lookbackMinutes;
    }

    /**
     * Start running cycles every {@code intervalSeconds}, the first one
     * immediately.
     *
     * @throws IllegalArgumentException if the interval is not positive
     * @throws IllegalStateException    if already started
     */
    public void start(int intervalSeconds) {
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("intervalSeconds must be >= 1, got: " + intervalSeconds);
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Detection scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "detection-scheduler");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::runScheduled, 0, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("Detection scheduled every {}s for resource {} (lookback {} min)",
                intervalSeconds, resourceId, lookbackMinutes);
    }

    /**
     * Stop the schedule, waiting briefly for an in-flight cycle.
     */
    public void stop() {
        if (executor != null && running.compareAndSet(true, false)) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            LOG.info("Detection scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Run one cycle on the calling thread and record its metrics.
     *
     * @return the cycle report
     */
    public DetectionReport runCycleNow() {
        long start = System.nanoTime();
        DetectionReport report = engine.runCycle(resourceId, lookbackMinutes);
        metrics.recordCycle(report, Duration.ofNanos(System.nanoTime() - start));
        return report;
    }

    private void runScheduled() {
        try {
            DetectionReport report = runCycleNow();
            if (report.isFetchFailedEntirely()) {
                LOG.warn("Scheduled cycle fetched no metrics: {}", report.getFetchErrors());
            }
            LOG.info("Cycle totals: cycles={}, incidents={}, storeErrors={}, fetchErrors={}",
                    (long) metrics.cycleCount(), (long) metrics.incidentCount(),
                    (long) metrics.storeErrorCount(), (long) metrics.fetchErrorCount());
        } catch (RuntimeException e) {
            LOG.error("Scheduled detection cycle failed: {}", e.getMessage(), e);
        }
    }
}
