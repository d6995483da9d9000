package io.flare.mentions.api.service;

import io.flare.mentions.api.dto.IngestionResult;
import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.dto.kafka.IngestionBatchEvent;
import io.flare.mentions.api.dto.kafka.MentionChangedEvent;
import io.flare.mentions.api.dto.kafka.MentionChangedEvent.ChangeType;
import io.flare.mentions.api.service.store.MentionChangeListener;
import io.flare.mentions.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes mention changes and ingestion batch summaries to Kafka. Publishing is best effort:
 * a failed send is logged and counted, never propagated to the writer.
 */
@Service
public class EventPublisherService implements MentionChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong processingTimeMs = new AtomicLong();

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    @Override
    public void onMentionChanged(ChangeType changeType, Mention mention) {
        publishMentionChanged(changeType, mention);
    }

    public void publishMentionChanged(ChangeType changeType, Mention mention) {
        MentionChangedEvent event = MentionChangedEvent.create(changeType, mention);
        String key = mention.id() != null ? String.valueOf(mention.id()) : mention.keyword();

        send(topics.mentionChanged(), key, event, "mention " + changeType + " " + mention.id());
    }

    public void publishIngestionBatch(String trigger, IngestionResult result) {
        IngestionBatchEvent event = IngestionBatchEvent.create(trigger, result);

        send(topics.ingestionBatch(), event.batchId(), event,
                String.format("batch %s (%d/%d articles for '%s')", event.batchId(),
                        event.appendedArticles(), event.fetchedArticles(), event.keyword()));
    }

    private void send(String topic, String key, Object event, String description) {
        attempts.incrementAndGet();
        long start = System.currentTimeMillis();

        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

            future.whenComplete((result, ex) -> {
                processingTimeMs.addAndGet(System.currentTimeMillis() - start);
                if (ex == null) {
                    published.incrementAndGet();
                    logger.debug("Sent {} to {} partition {}", description, topic,
                            result.getRecordMetadata().partition());
                } else {
                    failed.incrementAndGet();
                    logger.error("Failed to send {} to {}", description, topic, ex);
                }
            });

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing {} to {}", description, topic, e);
        }
    }

    /**
     * Unhealthy once more than half of at least ten send attempts failed.
     */
    public boolean isHealthy() {
        PublishingStats stats = getStats();
        return stats.totalAttempts() < 10 || stats.totalFailed() * 2 <= stats.totalAttempts();
    }

    public PublishingStats getStats() {
        return new PublishingStats(published.get(), failed.get(), attempts.get(), processingTimeMs.get());
    }

    public record PublishingStats(
            long totalPublished,
            long totalFailed,
            long totalAttempts,
            long totalProcessingTimeMs
    ) {
        public double getSuccessRate() {
            return totalAttempts > 0 ? (double) totalPublished / totalAttempts : 0.0;
        }

        public double getAverageProcessingTime() {
            long completed = totalPublished + totalFailed;
            return completed > 0 ? (double) totalProcessingTimeMs / completed : 0.0;
        }
    }
}
