package io.flare.mentions.api.service.stream;

import io.flare.mentions.api.dto.Article;

/**
 * An article as it sits in the log, with the id the log assigned on append.
 */
public record StreamEntry(
        String id,
        Article article
) {}
