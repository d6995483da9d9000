package io.flare.mentions.api.service.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw transport to the article-search provider.
 */
public interface ArticleSearchClient {

    /**
     * Runs a search and returns the provider's JSON response body.
     */
    JsonNode search(String keyword);
}
