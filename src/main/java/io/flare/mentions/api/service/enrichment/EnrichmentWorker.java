package io.flare.mentions.api.service.enrichment;

import io.flare.mentions.api.service.stream.PendingEntry;
import io.flare.mentions.api.service.stream.StreamEntry;
import io.flare.mentions.api.service.stream.StreamLog;
import io.flare.mentions.config.StreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One consumer of the enrichment group. Alternates a periodic reclaim of idle pending entries
 * with blocking reads of new ones, and finishes every entry it already claimed before
 * {@link #stop()} takes effect.
 */
public class EnrichmentWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentWorker.class);

    private final String consumerId;
    private final StreamLog streamLog;
    private final EnrichmentService enrichmentService;
    private final EnrichmentStats stats;
    private final StreamConfig config;
    private final Clock clock;

    private volatile boolean running = true;
    private Instant nextReclaim;

    public EnrichmentWorker(String consumerId, StreamLog streamLog, EnrichmentService enrichmentService,
                            EnrichmentStats stats, StreamConfig config, Clock clock) {
        this.consumerId = consumerId;
        this.streamLog = streamLog;
        this.enrichmentService = enrichmentService;
        this.stats = stats;
        this.config = config;
        this.clock = clock;
        this.nextReclaim = clock.instant();
    }

    @Override
    public void run() {
        logger.info("Enrichment worker {} started on {} / {}", consumerId, config.key(), config.consumerGroup());

        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce();
            } catch (RuntimeException e) {
                logger.error("Enrichment worker {} failed to poll the stream: {}", consumerId, e.getMessage(), e);
                if (!pause()) break;
                recreateGroup();
            }
        }

        logger.info("Enrichment worker {} stopped", consumerId);
    }

    /**
     * Runs one reclaim pass when due, then one read. Returns the number of entries processed.
     */
    int pollOnce() {
        int processed = 0;

        if (!clock.instant().isBefore(nextReclaim)) {
            processed += reclaimIdleEntries();
            nextReclaim = clock.instant().plus(config.reclaimInterval());
        }

        if (!running) return processed;

        List<StreamEntry> entries = streamLog.read(config.key(), config.consumerGroup(), consumerId,
                config.batchSize(), config.blockTimeout());
        processed += processAll(entries);

        return processed;
    }

    private int reclaimIdleEntries() {
        List<String> idleIds = streamLog.pending(config.key(), config.consumerGroup(), config.idleThreshold(),
                        config.batchSize()).stream()
                .map(PendingEntry::id)
                .toList();
        if (idleIds.isEmpty()) return 0;

        List<StreamEntry> claimed = streamLog.claim(config.key(), config.consumerGroup(), consumerId,
                config.idleThreshold(), idleIds);
        if (!claimed.isEmpty()) {
            logger.info("Worker {} reclaimed {} idle entries", consumerId, claimed.size());
            stats.recordReclaimed(claimed.size());
        }
        return processAll(claimed);
    }

    /**
     * Processes the claimed entries in order. Each one is renewed first: entries that waited in the
     * batch past the idle threshold may have been reclaimed by a peer and are left to it.
     */
    private int processAll(List<StreamEntry> entries) {
        int processed = 0;
        for (StreamEntry entry : entries) {
            try {
                if (!streamLog.renew(config.key(), config.consumerGroup(), consumerId, entry.id())) {
                    logger.info("Worker {} no longer owns entry {}, skipping it", consumerId, entry.id());
                    continue;
                }
                processed++;
                enrichmentService.process(entry);
            } catch (RuntimeException e) {
                logger.error("Unexpected failure enriching entry {}, it stays pending: {}", entry.id(), e.getMessage(), e);
            }
        }
        return processed;
    }

    private void recreateGroup() {
        try {
            streamLog.ensureGroup(config.key(), config.consumerGroup());
        } catch (RuntimeException e) {
            logger.warn("Worker {} could not ensure group {}: {}", consumerId, config.consumerGroup(), e.getMessage());
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(config.errorBackoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public String getConsumerId() {
        return consumerId;
    }
}
