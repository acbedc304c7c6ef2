package com.wildsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wildsentinel.core.adaptation.FeedbackAdaptationLoop;
import com.wildsentinel.core.adaptation.ParameterRegistry;
import com.wildsentinel.core.adaptation.ParameterSnapshot;
import com.wildsentinel.core.analytics.AccuracyAnalytics;
import com.wildsentinel.core.anomaly.ActivityAnomalyDetector;
import com.wildsentinel.core.anomaly.InMemoryBaselineStore;
import com.wildsentinel.core.classification.AlertClassifier;
import com.wildsentinel.core.config.EngineConfig;
import com.wildsentinel.core.config.EngineConfigLoader;
import com.wildsentinel.core.config.SpeciesCatalog;
import com.wildsentinel.core.context.InMemoryContextStore;
import com.wildsentinel.core.context.TimeLimitedContextStore;
import com.wildsentinel.core.correlation.CorrelationEngine;
import com.wildsentinel.core.dispatch.CameraRateLimiter;
import com.wildsentinel.core.dispatch.ChannelGateway;
import com.wildsentinel.core.dispatch.ChatChannel;
import com.wildsentinel.core.dispatch.EmailChannel;
import com.wildsentinel.core.dispatch.HttpDelivery;
import com.wildsentinel.core.dispatch.NotificationChannel;
import com.wildsentinel.core.dispatch.NotificationDispatcher;
import com.wildsentinel.core.dispatch.WebhookChannel;
import com.wildsentinel.core.evaluation.DetectionEvaluator;
import com.wildsentinel.core.repository.InMemoryAlertRepository;
import com.wildsentinel.core.repository.InMemoryAlertRuleRepository;
import com.wildsentinel.core.repository.InMemoryFeedbackRepository;
import com.wildsentinel.core.scoring.ConfidenceScorer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the wildlife alert service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (detections topic)
 *     → Deserialize JSON → DetectionEvent
 *     → Per-camera lane: validate, score, anomaly, classify, correlate
 *     → Kafka (alerts topic) for promoted alerts
 *     → Dispatch pool: rules, rate limit, quiet hours, digests, channels
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Runtime wiring is resolved from environment variables via
 * {@link ServiceConfig}; engine tuning comes from {@code engine.yml}.
 * </p>
 *
 * @since 1.0.0
 */
public final class WildlifeSentinelApplication {

    private static final Logger LOG = LoggerFactory.getLogger(WildlifeSentinelApplication.class);
    private static final Duration MAINTENANCE_INTERVAL = Duration.ofSeconds(30);

    private WildlifeSentinelApplication() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Wildlife Sentinel with config: {}", config);
        EngineConfig engine = loadEngineConfig(config);
        SpeciesCatalog catalog = engine.speciesCatalog();
        LOG.info("Loaded engine configuration with {} species profile(s)", catalog.size());

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = ServiceJson.newMapper();
        PrometheusMeterRegistry meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        EngineMetrics metrics = new EngineMetrics(meterRegistry);

        // 2. Stores and parameters
        InMemoryAlertRepository alerts = new InMemoryAlertRepository();
        InMemoryFeedbackRepository feedback = new InMemoryFeedbackRepository();
        InMemoryAlertRuleRepository rules = new InMemoryAlertRuleRepository();
        InMemoryContextStore history = new InMemoryContextStore();
        ExecutorService contextReads = Executors.newCachedThreadPool(AlertPipeline.named("context-read"));
        TimeLimitedContextStore context = new TimeLimitedContextStore(history, contextReads,
                config.getContextTimeout());
        ParameterRegistry parameters = new ParameterRegistry(ParameterSnapshot.initial(engine, clock.instant()));

        // 3. Evaluation
        CorrelationEngine correlation = new CorrelationEngine(engine.getCorrelation());
        DetectionEvaluator evaluator = new DetectionEvaluator(
                new ConfidenceScorer(engine.getScoring(), catalog, context),
                new ActivityAnomalyDetector(engine.getAnomaly(), new InMemoryBaselineStore(), context),
                new AlertClassifier(engine.getClassification(), catalog),
                correlation,
                alerts,
                parameters,
                history::record,
                clock);

        // 4. Delivery
        ExecutorService sendPool = Executors.newFixedThreadPool(config.getDispatchThreads(),
                AlertPipeline.named("channel-send"));
        NotificationDispatcher dispatcher = new NotificationDispatcher(engine.getNotification(),
                channels(config, engine, mapper),
                new ChannelGateway(engine.getNotification(), clock),
                new CameraRateLimiter(engine.getNotification(), clock),
                sendPool,
                clock);
        ExecutorService dispatchPool = new ThreadPoolExecutor(config.getDispatchThreads(),
                config.getDispatchThreads(), 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.getDispatchQueueCapacity()),
                AlertPipeline.named("dispatch"), new ThreadPoolExecutor.CallerRunsPolicy());

        // 5. Pipeline, adaptation and Kafka
        AlertPublisher publisher = new AlertPublisher(
                new KafkaProducer<>(config.kafkaProducerProperties()), config.getKafkaAlertTopic(), mapper);
        AlertPipeline pipeline = new AlertPipeline(evaluator, dispatcher, rules, correlation, publisher, metrics,
                config.getWorkerThreads(), config.getCameraQueueCapacity(), dispatchPool, clock);
        pipeline.startMaintenance(MAINTENANCE_INTERVAL);
        pipeline.schedule(new FeedbackAdaptationLoop(engine.getAdaptation(),
                ParameterSnapshot.Weights.of(engine.getScoring()), feedback, alerts, parameters, clock),
                engine.getAdaptation().interval());

        metrics.gauge("sentinel.parameters.version", "Published parameter snapshot version",
                () -> parameters.current().getVersion());
        metrics.gauge("sentinel.pipeline.queued", "Detections waiting in lanes", pipeline::queuedDetections);
        metrics.gauge("sentinel.dispatch.quiet_hours.queued", "Notifications held for quiet hours",
                dispatcher::queuedForQuietHours);
        metrics.gauge("sentinel.dispatch.digest.pending", "Alerts waiting in digests", dispatcher::pendingInDigests);

        DetectionConsumer consumer = new DetectionConsumer(
                new KafkaConsumer<>(config.kafkaConsumerProperties()), config.getKafkaDetectionTopic(), mapper,
                pipeline::submit, metrics);
        Thread consumerThread = new Thread(consumer, "detection-consumer");

        // 6. REST API, with shutdown hook
        AlertService service = new AlertService(alerts, feedback, rules, engine.getRuleDefaults(),
                new AccuracyAnalytics(alerts, feedback, clock), clock);
        AlertApiServer api = new AlertApiServer(service, mapper, meterRegistry::scrape, consumerThread::isAlive);
        api.start(config.getApiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            consumer.close();
            try {
                consumerThread.join(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            pipeline.close();
            sendPool.shutdown();
            contextReads.shutdownNow();
            publisher.close();
            api.stop();
        }, "sentinel-shutdown"));

        // 7. Run
        consumerThread.start();
        consumerThread.join();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EngineConfig loadEngineConfig(ServiceConfig config) {
        String path = config.getEngineConfigPath();
        if (path != null && !path.isBlank()) {
            return EngineConfigLoader.fromFile(path);
        }
        return EngineConfigLoader.load();
    }

    private static List<NotificationChannel> channels(ServiceConfig config, EngineConfig engine,
            ObjectMapper mapper) {
        Duration timeout = engine.getNotification().sendTimeout();
        HttpDelivery http = new HttpDelivery(timeout);
        List<NotificationChannel> channels = new ArrayList<>();
        channels.add(new WebhookChannel(http, mapper, config.getWebhookSecret(), config.getWebhookSignatureHeader()));
        channels.add(new ChatChannel(http, mapper));
        if (config.isEmailEnabled()) {
            channels.add(EmailChannel.smtp(config.getSmtpHost(), config.getSmtpPort(), config.getSmtpUsername(),
                    config.getSmtpPassword(), config.getSmtpFrom(), timeout));
        } else {
            LOG.warn("SMTP_HOST not set; email delivery disabled");
        }
        return channels;
    }
}
