package io.flare.mentions.api.service.stream;

import io.flare.mentions.api.dto.Article;

import java.time.Duration;
import java.util.List;

/**
 * Append-only log of articles with consumer-group reads.
 * <p>
 * Every group keeps its own cursor and claim state, so several groups can read the same log
 * without affecting each other. Inside one group an entry is owned by a single consumer at a time
 * until it is acknowledged or reclaimed.
 */
public interface StreamLog {

    /**
     * Appends one article and returns the log-assigned entry id.
     *
     * @throws io.flare.mentions.api.exception.LogAppendException if the log rejected the write
     */
    String append(String streamKey, Article article);

    /**
     * Appends a batch atomically: either every article is written, in order, or none is.
     *
     * @return entry ids in the order of {@code articles}
     * @throws io.flare.mentions.api.exception.LogAppendException if the log rejected the batch
     */
    List<String> appendAll(String streamKey, List<Article> articles);

    /**
     * Creates the consumer group (and the stream) when missing. Safe to call repeatedly.
     */
    void ensureGroup(String streamKey, String consumerGroup);

    /**
     * Claims up to {@code count} entries never delivered to the group, waiting at most
     * {@code blockTimeout} when none are available.
     */
    List<StreamEntry> read(String streamKey, String consumerGroup, String consumerId,
                           int count, Duration blockTimeout);

    /**
     * Marks an entry processed for the group. Acknowledging twice is a no-op.
     */
    void ack(String streamKey, String consumerGroup, String entryId);

    /**
     * Lists claimed entries that have stayed unacknowledged for at least {@code idleThreshold}.
     */
    List<PendingEntry> pending(String streamKey, String consumerGroup, Duration idleThreshold, int limit);

    /**
     * Moves idle pending entries to {@code consumerId}. Entries whose idle time dropped under
     * {@code idleThreshold} (for example because another consumer claimed them first) are skipped.
     */
    List<StreamEntry> claim(String streamKey, String consumerGroup, String consumerId,
                            Duration idleThreshold, List<String> entryIds);

    /**
     * Resets the idle time of an entry {@code consumerId} still owns, so no peer reclaims it while
     * it is being processed.
     *
     * @return {@code false} if the entry was acknowledged or reclaimed by another consumer meanwhile
     */
    boolean renew(String streamKey, String consumerGroup, String consumerId, String entryId);
}
