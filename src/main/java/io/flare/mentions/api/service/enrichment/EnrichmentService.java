package io.flare.mentions.api.service.enrichment;

import io.flare.mentions.api.dto.Article;
import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.dto.SentimentResult;
import io.flare.mentions.api.exception.ClassifierTerminalException;
import io.flare.mentions.api.exception.ClassifierTransientException;
import io.flare.mentions.api.exception.StoreException;
import io.flare.mentions.api.exception.StoreRejectedException;
import io.flare.mentions.api.service.store.MentionStore;
import io.flare.mentions.api.service.stream.StreamEntry;
import io.flare.mentions.api.service.stream.StreamLog;
import io.flare.mentions.config.EnrichmentConfig;
import io.flare.mentions.config.MentionsConfig;
import io.flare.mentions.config.NoiseFilterConfig;
import io.flare.mentions.config.StreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Classifies one claimed stream entry and persists the result.
 * <p>
 * The entry is acknowledged only after the store write succeeded. A transient classifier failure
 * leaves it unacknowledged so the reclaim pass redelivers it; once the failures for an entry exceed
 * {@code maxReclaims} the article is stored without sentiment and acknowledged.
 * <p>
 * Transient store failures leave the entry pending without touching its failure count. A row the
 * store rejects outright falls back to the unenriched write, and is dropped if that is rejected too.
 * Any other unexpected error counts against the same {@code maxReclaims} budget.
 */
@Service
public class EnrichmentService {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentService.class);

    private final SentimentClassifier classifier;
    private final MentionStore store;
    private final StreamLog streamLog;
    private final FailureCounter failureCounter;
    private final EnrichmentStats stats;
    private final Clock clock;
    private final StreamConfig streamConfig;
    private final EnrichmentConfig enrichmentConfig;

    public EnrichmentService(SentimentClassifier classifier,
                             MentionStore store,
                             StreamLog streamLog,
                             FailureCounter failureCounter,
                             EnrichmentStats stats,
                             Clock clock,
                             MentionsConfig config) {
        this.classifier = classifier;
        this.store = store;
        this.streamLog = streamLog;
        this.failureCounter = failureCounter;
        this.stats = stats;
        this.clock = clock;
        this.streamConfig = config.stream();
        this.enrichmentConfig = config.enrichment();
    }

    public EntryState process(StreamEntry entry) {
        EntryState state = doProcess(entry);
        stats.recordOutcome(state);
        return state;
    }

    private EntryState doProcess(StreamEntry entry) {
        logger.debug("Entry {} {}: '{}'", entry.id(), EntryState.CLAIMED, entry.article().title());

        if (enrichmentConfig.isNoiseFilterEnabled() && isNoise(entry.article(), enrichmentConfig.noiseFilter())) {
            logger.debug("Entry {} {}: '{}'", entry.id(), EntryState.FILTERED, entry.article().title());
            ack(entry);
            return EntryState.FILTERED;
        }

        SentimentResult sentiment;
        try {
            logger.debug("Entry {} {}", entry.id(), EntryState.CLASSIFYING);
            sentiment = classifier.classify(classifierInput(entry.article(), enrichmentConfig.inputLimit()));

        } catch (ClassifierTransientException e) {
            return retryOrGiveUp(entry, "classifier failure", e) ? EntryState.FAILED_RETRYABLE : persistUnenriched(entry);

        } catch (ClassifierTerminalException e) {
            logger.warn("Entry {} cannot be classified ({}): {}", entry.id(), e.getCategory(), e.getMessage());
            return persistUnenriched(entry);

        } catch (RuntimeException e) {
            logger.error("Unexpected classifier error for entry {}", entry.id(), e);
            return retryOrGiveUp(entry, "classifier error", e) ? EntryState.FAILED_RETRYABLE : persistUnenriched(entry);
        }

        try {
            Mention mention = store.upsertEnriched(entry, sentiment, clock.instant());
            ack(entry);
            failureCounter.clear(entry.id());

            logger.debug("Entry {} {} as mention {} ({} {})", entry.id(), EntryState.ENRICHED,
                    mention.id(), sentiment.label(), sentiment.score());
            return EntryState.ENRICHED;

        } catch (StoreRejectedException e) {
            stats.recordStoreFailure();
            logger.warn("Store rejected the enriched row for entry {}, storing it without sentiment: {}",
                    entry.id(), e.getMessage());
            return persistUnenriched(entry);

        } catch (StoreException e) {
            stats.recordStoreFailure();
            logger.error("Store write failed for entry {}, leaving it for redelivery: {}", entry.id(), e.getMessage());
            return EntryState.FAILED_RETRYABLE;

        } catch (RuntimeException e) {
            stats.recordStoreFailure();
            logger.error("Unexpected store error for entry {}", entry.id(), e);
            return retryOrGiveUp(entry, "store error", e) ? EntryState.FAILED_RETRYABLE : persistUnenriched(entry);
        }
    }

    private EntryState persistUnenriched(StreamEntry entry) {
        try {
            store.upsertRaw(entry);

        } catch (StoreRejectedException e) {
            stats.recordStoreFailure();
            logger.error("Store rejected entry {}, dropping it: {}", entry.id(), e.getMessage());
            return drop(entry);

        } catch (StoreException e) {
            stats.recordStoreFailure();
            logger.error("Store write failed for unenriched entry {}, leaving it for redelivery: {}",
                    entry.id(), e.getMessage());
            return EntryState.FAILED_RETRYABLE;

        } catch (RuntimeException e) {
            stats.recordStoreFailure();
            logger.error("Unexpected store error for unenriched entry {}", entry.id(), e);
            return retryOrGiveUp(entry, "store error", e) ? EntryState.FAILED_RETRYABLE : drop(entry);
        }

        return drop(entry);
    }

    /**
     * Counts one failure against the entry. Returns {@code true} while the entry may still be
     * redelivered, {@code false} once it has used up {@code maxReclaims}.
     */
    private boolean retryOrGiveUp(StreamEntry entry, String reason, RuntimeException e) {
        long failures = failureCounter.recordFailure(entry.id());
        if (failures > enrichmentConfig.maxReclaims()) {
            logger.warn("Entry {} failed {} times, giving up after {}: {}", entry.id(), failures, reason, e.getMessage());
            return false;
        }
        logger.warn("Entry {} hit a {} ({}/{}), leaving it for redelivery: {}",
                entry.id(), reason, failures, enrichmentConfig.maxReclaims(), e.getMessage());
        return true;
    }

    private EntryState drop(StreamEntry entry) {
        ack(entry);
        failureCounter.clear(entry.id());
        return EntryState.FAILED_TERMINAL;
    }

    private void ack(StreamEntry entry) {
        streamLog.ack(streamConfig.key(), streamConfig.consumerGroup(), entry.id());
    }

    static boolean isNoise(Article article, NoiseFilterConfig filter) {
        String title = article.title() != null ? article.title().trim() : "";
        String description = article.description() != null ? article.description().trim() : "";
        return title.length() < filter.minTitleLength() || description.length() < filter.minDescriptionLength();
    }

    /**
     * Title followed by the description, or by the content when there is no description,
     * cut to {@code limit} characters.
     */
    static String classifierInput(Article article, int limit) {
        String title = article.title() != null ? article.title().trim() : "";
        String body = article.description() != null && !article.description().isBlank()
                ? article.description().trim()
                : article.content() != null ? article.content().trim() : "";

        String text;
        if (title.isEmpty()) {
            text = body;
        } else if (body.isEmpty()) {
            text = title;
        } else {
            text = title + ". " + body;
        }

        if (text.length() <= limit) return text;

        int end = limit;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
