package io.flare.mentions.api.service.enrichment;

import io.flare.mentions.api.service.stream.StreamLog;
import io.flare.mentions.config.EnrichmentConfig;
import io.flare.mentions.config.MentionsConfig;
import io.flare.mentions.config.StreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured number of {@link EnrichmentWorker}s, each with its own consumer name,
 * for the lifetime of the application context.
 */
@Component
@ConditionalOnProperty(prefix = "mentions.enrichment", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EnrichmentWorkerPool implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentWorkerPool.class);

    private final StreamLog streamLog;
    private final EnrichmentService enrichmentService;
    private final EnrichmentStats stats;
    private final Clock clock;
    private final StreamConfig streamConfig;
    private final EnrichmentConfig enrichmentConfig;

    private final List<EnrichmentWorker> workers = new ArrayList<>();
    private ExecutorService executor;
    private volatile boolean running;

    public EnrichmentWorkerPool(StreamLog streamLog,
                                EnrichmentService enrichmentService,
                                EnrichmentStats stats,
                                Clock clock,
                                MentionsConfig config) {
        this.streamLog = streamLog;
        this.enrichmentService = enrichmentService;
        this.stats = stats;
        this.clock = clock;
        this.streamConfig = config.stream();
        this.enrichmentConfig = config.enrichment();
    }

    @Override
    public synchronized void start() {
        if (running) return;

        try {
            streamLog.ensureGroup(streamConfig.key(), streamConfig.consumerGroup());
        } catch (RuntimeException e) {
            // workers retry the group creation after their first failed read
            logger.warn("Could not create consumer group '{}' on '{}': {}",
                    streamConfig.consumerGroup(), streamConfig.key(), e.getMessage());
        }

        int size = Math.max(1, enrichmentConfig.workers());
        executor = Executors.newFixedThreadPool(size, new CustomizableThreadFactory("enrichment-worker-"));

        String prefix = streamConfig.consumerPrefix() + ProcessHandle.current().pid() + "-";
        for (int i = 0; i < size; i++) {
            EnrichmentWorker worker = new EnrichmentWorker(prefix + i, streamLog, enrichmentService, stats,
                    streamConfig, clock);
            workers.add(worker);
            executor.submit(worker);
        }

        running = true;
        logger.info("Started {} enrichment workers on stream '{}' (group '{}')",
                size, streamConfig.key(), streamConfig.consumerGroup());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;

        logger.info("Stopping {} enrichment workers", workers.size());
        workers.forEach(EnrichmentWorker::stop);
        executor.shutdown();

        try {
            if (!executor.awaitTermination(enrichmentConfig.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Enrichment workers did not finish within {}, interrupting",
                        enrichmentConfig.shutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        workers.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public List<String> getConsumerIds() {
        synchronized (this) {
            return workers.stream().map(EnrichmentWorker::getConsumerId).toList();
        }
    }
}
