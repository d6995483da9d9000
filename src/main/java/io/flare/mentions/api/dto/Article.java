package io.flare.mentions.api.dto;

import java.time.Instant;

public record Article(
        String keyword,
        String sourceName,
        String author,
        String title,
        String description,
        String url,
        String imageUrl,
        Instant publishedAt,
        String content
) {
    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
