package io.flare.mentions.api.service.store;

import io.flare.mentions.api.service.stream.StreamEntry;

/**
 * Uniqueness key of a mention: the keyword plus the article url, or the stream entry id
 * when the article has no url.
 */
public record MentionKey(
        String keyword,
        String dedupKey
) {
    private static final String ENTRY_PREFIX = "entry:";

    public static MentionKey of(String keyword, String url, String entryId) {
        if (url != null && !url.isBlank()) {
            return new MentionKey(keyword, url);
        }
        if (entryId == null || entryId.isBlank()) {
            throw new IllegalArgumentException("An article without url needs a stream entry id");
        }
        return new MentionKey(keyword, ENTRY_PREFIX + entryId);
    }

    public static MentionKey of(StreamEntry entry) {
        return of(entry.article().keyword(), entry.article().url(), entry.id());
    }
}
