package io.flare.mentions.api.service.source;

import io.flare.mentions.api.dto.Article;

import java.util.List;

public interface SourceAdapter {

    /**
     * Fetches and normalizes the provider's articles for a keyword.
     *
     * @return the articles, empty when the provider has no matches
     * @throws io.flare.mentions.api.exception.UpstreamUnavailableException on network errors or non-2xx responses
     * @throws io.flare.mentions.api.exception.UpstreamQuotaExceededException when the provider rate-limits us
     */
    List<Article> fetch(String keyword);
}
