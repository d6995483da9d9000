package io.flare.mentions.api;

import io.flare.mentions.api.service.EventPublisherService;
import io.flare.mentions.api.service.enrichment.EnrichmentStats;
import io.flare.mentions.api.service.enrichment.EnrichmentWorkerPool;
import io.flare.mentions.config.MentionsConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final EventPublisherService eventPublisher;
    private final EnrichmentStats enrichmentStats;
    private final ObjectProvider<EnrichmentWorkerPool> workerPool;
    private final MentionsConfig config;

    public PipelineController(EventPublisherService eventPublisher,
                              EnrichmentStats enrichmentStats,
                              ObjectProvider<EnrichmentWorkerPool> workerPool,
                              MentionsConfig config) {
        this.eventPublisher = eventPublisher;
        this.enrichmentStats = enrichmentStats;
        this.workerPool = workerPool;
        this.config = config;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean eventPublisherHealthy = eventPublisher.isHealthy();
        var stats = eventPublisher.getStats();
        EnrichmentWorkerPool pool = workerPool.getIfAvailable();
        boolean workersRunning = pool == null || pool.isRunning();

        boolean healthy = eventPublisherHealthy && workersRunning;
        var healthInfo = Map.of(
                "status", healthy ? "UP" : "DOWN",
                "service", "Mentions Pipeline",
                "timestamp", Instant.now(),
                "messaging", Map.of(
                        "healthy", eventPublisherHealthy,
                        "totalPublished", stats.totalPublished(),
                        "successRate", String.format("%.2f%%", stats.getSuccessRate() * 100)
                ),
                "enrichment", Map.of(
                        "enabled", pool != null,
                        "running", pool != null && pool.isRunning()
                )
        );

        return healthy ?
                ResponseEntity.ok(healthInfo) :
                ResponseEntity.status(503).body(healthInfo);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        var stats = eventPublisher.getStats();
        var enrichment = enrichmentStats.snapshot();
        EnrichmentWorkerPool pool = workerPool.getIfAvailable();
        List<String> consumers = pool != null ? pool.getConsumerIds() : List.of();

        return ResponseEntity.ok(Map.of(
                "ingestion", Map.of(
                        "keywords", config.ingestion().getActiveKeywords(),
                        "schedulingEnabled", config.ingestion().enableScheduling(),
                        "intervalMs", config.ingestion().getScheduleIntervalMs()
                ),
                "stream", Map.of(
                        "key", config.stream().key(),
                        "consumerGroup", config.stream().consumerGroup(),
                        "consumers", consumers
                ),
                "enrichment", Map.of(
                        "enriched", enrichment.enriched(),
                        "retryable", enrichment.retryable(),
                        "terminal", enrichment.terminal(),
                        "filtered", enrichment.filtered(),
                        "storeFailures", enrichment.storeFailures(),
                        "reclaimed", enrichment.reclaimed()
                ),
                "publishing", Map.of(
                        "totalEventsPublished", stats.totalPublished(),
                        "totalEventsFailed", stats.totalFailed(),
                        "averageProcessingTime", String.format("%.2fms", stats.getAverageProcessingTime()),
                        "successRate", String.format("%.2f%%", stats.getSuccessRate() * 100)
                )
        ));
    }
}
