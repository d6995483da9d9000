package io.flare.mentions.api.service.store;

import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.dto.SentimentResult;
import io.flare.mentions.api.service.stream.StreamEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed table of mentions holding at most one row per {@link MentionKey}.
 */
public interface MentionStore {

    /**
     * Inserts the article without sentiment when no row exists for its key; otherwise returns
     * the existing row untouched.
     */
    Mention upsertRaw(StreamEntry entry);

    /**
     * Inserts the article with sentiment, or sets sentiment label, score and {@code enrichedAt}
     * on the existing row. Article fields, {@code lead} and {@code note} of an existing row never change.
     */
    Mention upsertEnriched(StreamEntry entry, SentimentResult sentiment, Instant enrichedAt);

    Optional<Mention> findByKey(MentionKey key);

    /**
     * Mentions for a keyword, newest {@code published_at} first.
     */
    List<Mention> findByKeyword(String keyword);

    List<Mention> findLeads();
}
