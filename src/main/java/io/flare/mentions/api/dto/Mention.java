package io.flare.mentions.api.dto;

import java.time.Instant;

/**
 * A stored article for one keyword. Sentiment fields stay null until enrichment succeeds;
 * {@code lead} and {@code note} belong to the editing side and are only read here.
 */
public record Mention(
        Long id,
        String keyword,
        String url,
        String sourceName,
        String author,
        String title,
        String description,
        String imageUrl,
        Instant publishedAt,
        String content,
        SentimentLabel sentimentLabel,
        Double sentimentScore,
        boolean lead,
        String note,
        String streamEntryId,
        Instant insertedAt,
        Instant enrichedAt
) {
    public boolean isEnriched() {
        return sentimentLabel != null;
    }
}
