package io.flare.mentions.api.service.ingestion;

import io.flare.mentions.api.dto.Article;
import io.flare.mentions.api.dto.IngestionResult;
import io.flare.mentions.api.exception.ErrorCategory;
import io.flare.mentions.api.exception.StoreException;
import io.flare.mentions.api.exception.UpstreamException;
import io.flare.mentions.api.service.EventPublisherService;
import io.flare.mentions.api.service.source.SourceAdapter;
import io.flare.mentions.api.service.store.MentionStore;
import io.flare.mentions.api.service.stream.StreamEntry;
import io.flare.mentions.api.service.stream.StreamLog;
import io.flare.mentions.config.IngestionConfig;
import io.flare.mentions.config.MentionsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * One ingestion cycle for a keyword: fetch from the source (with retries), drop recently seen
 * articles, append the rest to the stream as one batch.
 */
@Service
public class IngestionService {

    public static final String TRIGGER_SCHEDULED = "scheduled";
    public static final String TRIGGER_MANUAL = "manual";

    /** Width of the {@code mentions.keyword} column. */
    public static final int MAX_KEYWORD_LENGTH = 255;

    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    private final SourceAdapter sourceAdapter;
    private final StreamLog streamLog;
    private final MentionStore mentionStore;
    private final IngestDeduplicationService deduplicationService;
    private final EventPublisherService eventPublisher;
    private final RetryTemplate retryTemplate;
    private final IngestionConfig ingestionConfig;
    private final String streamKey;

    public IngestionService(SourceAdapter sourceAdapter,
                            StreamLog streamLog,
                            MentionStore mentionStore,
                            IngestDeduplicationService deduplicationService,
                            EventPublisherService eventPublisher,
                            @Qualifier("sourceRetryTemplate") RetryTemplate retryTemplate,
                            MentionsConfig config) {
        this.sourceAdapter = sourceAdapter;
        this.streamLog = streamLog;
        this.mentionStore = mentionStore;
        this.deduplicationService = deduplicationService;
        this.eventPublisher = eventPublisher;
        this.retryTemplate = retryTemplate;
        this.ingestionConfig = config.ingestion();
        this.streamKey = config.stream().key();
    }

    /**
     * Runs one cycle. An exhausted source is reported as {@link IngestionResult.Outcome#ABANDONED};
     * a rejected append is not caught.
     *
     * @throws IllegalArgumentException if the keyword is blank or longer than {@link #MAX_KEYWORD_LENGTH}
     * @throws io.flare.mentions.api.exception.LogAppendException if the stream rejected the batch
     */
    public IngestionResult ingest(String keyword, String trigger) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Keyword must not be blank");
        }
        String searchKeyword = keyword.trim();
        if (searchKeyword.length() > MAX_KEYWORD_LENGTH) {
            throw new IllegalArgumentException("Keyword must not exceed " + MAX_KEYWORD_LENGTH + " characters");
        }
        long startTime = System.currentTimeMillis();

        List<Article> fetched;
        try {
            fetched = fetchWithRetry(searchKeyword);
        } catch (UpstreamException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.warn("Abandoning ingestion cycle for '{}' after retries ({}): {}",
                    searchKeyword, e.getCategory(), e.getMessage());

            IngestionResult result = IngestionResult.abandoned(searchKeyword, e.getCategory(), duration);
            eventPublisher.publishIngestionBatch(trigger, result);
            return result;
        }

        List<Article> fresh = filterNewArticles(fetched);
        int skipped = fetched.size() - fresh.size();

        List<String> entryIds = streamLog.appendAll(streamKey, fresh);
        markAsIngested(fresh);

        if (ingestionConfig.rawFastPath()) {
            persistRaw(fresh, entryIds);
        }

        long duration = System.currentTimeMillis() - startTime;
        IngestionResult result = IngestionResult.appended(searchKeyword, fetched.size(), skipped, entryIds, duration);
        eventPublisher.publishIngestionBatch(trigger, result);

        logger.info("Ingested '{}' ({}): {} fetched, {} appended, {} already seen in {}ms",
                searchKeyword, trigger, fetched.size(), entryIds.size(), skipped, duration);
        return result;
    }

    private List<Article> fetchWithRetry(String keyword) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                Throwable last = context.getLastThrowable();
                ErrorCategory category = last instanceof UpstreamException upstream
                        ? upstream.getCategory() : ErrorCategory.UNKNOWN;
                logger.warn("Retrying fetch for '{}' (attempt {}) after {}: {}", keyword,
                        context.getRetryCount() + 1, category, last.getMessage());
            }
            return sourceAdapter.fetch(keyword);
        });
    }

    private List<Article> filterNewArticles(List<Article> articles) {
        if (!ingestionConfig.isDedupEnabled()) return articles;

        return articles.stream()
                .filter(article -> !deduplicationService.isAlreadyIngested(article))
                .toList();
    }

    private void markAsIngested(List<Article> articles) {
        try {
            articles.forEach(deduplicationService::markAsIngested);
        } catch (RuntimeException e) {
            logger.warn("Could not record {} appended articles in the dedup window, a later cycle may append them again: {}",
                    articles.size(), e.getMessage());
        }
    }

    private void persistRaw(List<Article> articles, List<String> entryIds) {
        List<StreamEntry> entries = new ArrayList<>(articles.size());
        for (int i = 0; i < articles.size(); i++) {
            entries.add(new StreamEntry(entryIds.get(i), articles.get(i)));
        }

        for (StreamEntry entry : entries) {
            try {
                mentionStore.upsertRaw(entry);
            } catch (StoreException e) {
                logger.warn("Raw upsert of entry {} failed, enrichment will persist it: {}", entry.id(), e.getMessage());
            }
        }
    }
}
