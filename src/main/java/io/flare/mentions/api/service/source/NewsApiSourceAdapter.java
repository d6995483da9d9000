package io.flare.mentions.api.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.flare.mentions.api.dto.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns NewsAPI search results into {@link Article}s. A malformed result never fails the batch:
 * missing values fall back to defaults and only non-object elements are skipped.
 */
@Service
public class NewsApiSourceAdapter implements SourceAdapter {

    private static final Logger logger = LoggerFactory.getLogger(NewsApiSourceAdapter.class);

    static final String UNKNOWN = "Unknown";

    private final ArticleSearchClient client;
    private final Clock clock;

    public NewsApiSourceAdapter(ArticleSearchClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public List<Article> fetch(String keyword) {
        JsonNode response = client.search(keyword);
        JsonNode results = response != null ? response.path("articles") : null;

        if (results == null || !results.isArray() || results.isEmpty()) {
            logger.debug("No articles for '{}' (totalResults={})", keyword,
                    response != null ? response.path("totalResults").asInt(0) : 0);
            return List.of();
        }

        Instant ingestedAt = clock.instant();
        List<Article> articles = new ArrayList<>(results.size());

        for (JsonNode node : results) {
            if (!node.isObject()) {
                logger.warn("Skipping non-object search result for '{}': {}", keyword, node.getNodeType());
                continue;
            }
            articles.add(convertToArticle(keyword, node, ingestedAt));
        }

        return articles;
    }

    private Article convertToArticle(String keyword, JsonNode node, Instant ingestedAt) {
        return new Article(
                keyword,
                textOr(node.path("source").path("name"), UNKNOWN),
                textOr(node.path("author"), UNKNOWN),
                textOr(node.path("title"), ""),
                textOr(node.path("description"), ""),
                textOr(node.path("url"), null),
                textOr(node.path("urlToImage"), null),
                parsePublishedAt(node.path("publishedAt"), ingestedAt),
                textOr(node.path("content"), "")
        );
    }

    private Instant parsePublishedAt(JsonNode value, Instant fallback) {
        String text = textOr(value, null);
        if (text == null) return fallback;

        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable publishedAt '{}', using ingestion time", text);
            return fallback;
        }
    }

    private static String textOr(JsonNode value, String fallback) {
        if (value == null || value.isMissingNode() || value.isNull()) return fallback;

        String text = value.isTextual() ? value.asText().trim() : value.toString();
        return text.isEmpty() ? fallback : text;
    }
}
