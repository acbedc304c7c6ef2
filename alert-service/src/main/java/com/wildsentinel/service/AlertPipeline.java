package com.wildsentinel.service;

import com.wildsentinel.core.correlation.CorrelationEngine;
import com.wildsentinel.core.dispatch.DispatchReport;
import com.wildsentinel.core.dispatch.NotificationDispatcher;
import com.wildsentinel.core.evaluation.DetectionEvaluator;
import com.wildsentinel.core.evaluation.EvaluationResult;
import com.wildsentinel.core.evaluation.InvalidDetectionException;
import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.DeliveryReceipt;
import com.wildsentinel.core.model.DetectionEvent;
import com.wildsentinel.core.repository.AlertRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Concurrent detection pipeline: evaluation lanes feeding a dispatch pool.
 *
 * <h3>Lanes</h3>
 * <p>
 * Each camera hashes onto one of {@code lanes} single-threaded workers with a
 * bounded queue, so detections from one camera are evaluated strictly in
 * submission order while different cameras proceed in parallel. A full lane
 * blocks the submitter.
 * </p>
 *
 * <h3>Cancellation</h3>
 * <p>
 * The future returned by {@link #submit(DetectionEvent)} completes once the
 * alert has been handed to the dispatch pool. Cancelling it before then,
 * with or without interruption, keeps the detection from being dispatched;
 * sends already in flight are not affected.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Rejected detections are counted and kept in a bounded ingest-error log.
 * Unexpected failures are logged with camera, species, timestamp and stage,
 * and surface through the returned future only.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertPipeline.class);

    public static final int INGEST_ERROR_LOG_SIZE = 200;

    /** One rejected detection. */
    public record IngestError(Instant at, String cameraId, String detectionId, List<String> problems) {
    }

    private final DetectionEvaluator evaluator;
    private final NotificationDispatcher dispatcher;
    private final AlertRuleRepository rules;
    private final CorrelationEngine correlation;
    private final Consumer<Alert> publisher;
    private final EngineMetrics metrics;
    private final ExecutorService dispatchPool;
    private final Clock clock;

    private final ThreadPoolExecutor[] lanes;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong ingestErrorCount = new AtomicLong();
    private final Deque<IngestError> ingestErrors = new ArrayDeque<>();

    /**
     * @param publisher    receives promoted and superseded alerts, e.g. the
     *                     Kafka {@link AlertPublisher}
     * @param dispatchPool runs notification dispatch, separate from the lanes
     */
    public AlertPipeline(DetectionEvaluator evaluator,
            NotificationDispatcher dispatcher,
            AlertRuleRepository rules,
            CorrelationEngine correlation,
            Consumer<Alert> publisher,
            EngineMetrics metrics,
            int laneCount,
            int laneCapacity,
            ExecutorService dispatchPool,
            Clock clock) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.dispatchPool = Objects.requireNonNull(dispatchPool, "dispatchPool must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (laneCount < 1 || laneCapacity < 1) {
            throw new IllegalArgumentException(
                    "laneCount and laneCapacity must be >= 1, got: " + laneCount + ", " + laneCapacity);
        }

        this.lanes = new ThreadPoolExecutor[laneCount];
        for (int i = 0; i < laneCount; i++) {
            lanes[i] = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(laneCapacity), named("detection-lane-" + i), BLOCK_WHEN_FULL);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(named("pipeline-maintenance"));
    }

    // ---------------------------------------------------------------
    // Submission
    // ---------------------------------------------------------------

    /**
     * Queue one detection on its camera's lane.
     *
     * @throws RejectedExecutionException if the pipeline is shut down or the
     *                                    caller is interrupted while waiting
     *                                    for lane capacity
     */
    public Future<EvaluationResult> submit(DetectionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        Evaluation evaluation = new Evaluation(event);
        FutureTask<EvaluationResult> task = new FutureTask<>(evaluation);
        evaluation.handle = task;
        laneFor(event.getCameraId()).execute(task);
        return task;
    }

    int laneIndex(String cameraId) {
        return cameraId == null ? 0 : Math.floorMod(cameraId.hashCode(), lanes.length);
    }

    private ThreadPoolExecutor laneFor(String cameraId) {
        return lanes[laneIndex(cameraId)];
    }

    private EvaluationResult process(DetectionEvent event, Future<?> handle) {
        long start = System.nanoTime();
        EvaluationResult result;
        try {
            result = evaluator.evaluate(event);
        } catch (InvalidDetectionException e) {
            recordIngestError(event, e.getProblems());
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementProcessingFailures();
            LOG.error("Evaluation failed [stage=evaluate, camera={}, species={}, timestamp={}]: {}",
                    event.getCameraId(), event.getSpecies(), event.getTimestamp(), e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordLatency(Duration.ofNanos(System.nanoTime() - start));
        }
        metrics.recordOutcome(result.outcome());

        EvaluationResult.Outcome outcome = result.outcome();
        if (outcome == EvaluationResult.Outcome.PROMOTED || outcome == EvaluationResult.Outcome.SUPERSEDED) {
            publish(result.alert());
        }
        if (result.isDispatchable()) {
            Alert alert = result.alert();
            if (handle.isCancelled() || Thread.currentThread().isInterrupted()) {
                LOG.debug("Detection {} cancelled; alert {} not dispatched", event.getDetectionId(), alert.getId());
            } else {
                dispatchPool.execute(() -> dispatch(alert));
            }
        }
        return result;
    }

    private void publish(Alert alert) {
        try {
            publisher.accept(alert);
        } catch (RuntimeException e) {
            LOG.error("Publishing failed [stage=publish, camera={}, species={}, timestamp={}]: {}",
                    alert.getCameraId(), alert.getSpecies(), alert.getDetectedAt(), e.getMessage(), e);
        }
    }

    private void dispatch(Alert alert) {
        try {
            DispatchReport report = dispatcher.dispatch(alert, rules.findActive());
            recordReceipts(report.receipts());
            if (report.rateLimited()) {
                LOG.info("Alert {} on {} rate limited", alert.getId(), alert.getCameraId());
            }
        } catch (RuntimeException e) {
            metrics.incrementProcessingFailures();
            LOG.error("Dispatch failed [stage=dispatch, alert={}, camera={}, species={}, timestamp={}]: {}",
                    alert.getId(), alert.getCameraId(), alert.getSpecies(), alert.getDetectedAt(),
                    e.getMessage(), e);
        }
    }

    private void recordReceipts(Collection<DeliveryReceipt> receipts) {
        for (DeliveryReceipt receipt : receipts) {
            metrics.recordDelivery(receipt.getStatus());
        }
    }

    private void recordIngestError(DetectionEvent event, List<String> problems) {
        ingestErrorCount.incrementAndGet();
        metrics.incrementRejected();
        LOG.warn("Rejected detection [stage=ingress, camera={}, species={}, timestamp={}]: {}",
                event.getCameraId(), event.getSpecies(), event.getTimestamp(), problems);
        synchronized (ingestErrors) {
            if (ingestErrors.size() == INGEST_ERROR_LOG_SIZE) {
                ingestErrors.pollFirst();
            }
            ingestErrors.addLast(new IngestError(clock.instant(), event.getCameraId(),
                    event.getDetectionId(), List.copyOf(problems)));
        }
    }

    // ---------------------------------------------------------------
    // Maintenance
    // ---------------------------------------------------------------

    /**
     * Start the periodic maintenance task: release quiet-hour queues and due
     * digests, and evict expired correlation entries.
     */
    public void startMaintenance(Duration interval) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::runMaintenance, millis, millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Run {@code task} every {@code interval} on the maintenance thread.
     */
    public void schedule(Runnable task, Duration interval) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(task, millis, millis, TimeUnit.MILLISECONDS);
    }

    void runMaintenance() {
        try {
            recordReceipts(dispatcher.flushDue());
            int evicted = correlation.evictExpired(clock.instant());
            if (evicted > 0) {
                LOG.debug("Evicted {} expired correlation entries", evicted);
            }
        } catch (RuntimeException e) {
            LOG.error("Maintenance run failed: {}", e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------

    public long getIngestErrorCount() {
        return ingestErrorCount.get();
    }

    /**
     * @return the most recent rejections, oldest first
     */
    public List<IngestError> recentIngestErrors() {
        synchronized (ingestErrors) {
            return new ArrayList<>(ingestErrors);
        }
    }

    public int queuedDetections() {
        int total = 0;
        for (ThreadPoolExecutor lane : lanes) {
            total += lane.getQueue().size();
        }
        return total;
    }

    // ---------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------

    /**
     * Drain the lanes, flush pending digests and stop every worker.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
        for (ThreadPoolExecutor lane : lanes) {
            lane.shutdown();
        }
        try {
            for (ThreadPoolExecutor lane : lanes) {
                if (!lane.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOG.warn("Lane did not drain in time; {} detections dropped", lane.shutdownNow().size());
                }
            }
            dispatchPool.shutdown();
            if (!dispatchPool.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Dispatch pool did not finish in time");
                dispatchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatchPool.shutdownNow();
        }
        recordReceipts(dispatcher.flushAll());
        LOG.info("Alert pipeline stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private final class Evaluation implements Callable<EvaluationResult> {

        private final DetectionEvent event;
        private volatile Future<?> handle;

        Evaluation(DetectionEvent event) {
            this.event = event;
        }

        @Override
        public EvaluationResult call() {
            return process(event, handle);
        }
    }

    private static final RejectedExecutionHandler BLOCK_WHEN_FULL = (task, executor) -> {
        if (executor.isShutdown()) {
            throw new RejectedExecutionException("Pipeline is shut down");
        }
        try {
            executor.getQueue().put(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RejectedExecutionException("Interrupted while waiting for lane capacity", e);
        }
    };

    static ThreadFactory named(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, counter.getAndIncrement() == 0 ? name : name + "-" + counter.get());
            t.setDaemon(true);
            return t;
        };
    }
}
