package io.flare.mentions.api.service.stream;

import io.flare.mentions.api.dto.Article;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat string map layout of an {@link Article} inside a stream entry. Absent values are written as "".
 */
public final class ArticleFields {

    public static final String KEYWORD = "search_keyword";
    public static final String SOURCE = "source";
    public static final String AUTHOR = "author";
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String URL = "url";
    public static final String IMAGE_URL = "urlToImage";
    public static final String PUBLISHED_AT = "publishedAt";
    public static final String CONTENT = "content";

    private ArticleFields() {
    }

    public static Map<String, String> toFields(Article article) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(KEYWORD, orEmpty(article.keyword()));
        fields.put(SOURCE, orEmpty(article.sourceName()));
        fields.put(AUTHOR, orEmpty(article.author()));
        fields.put(TITLE, orEmpty(article.title()));
        fields.put(DESCRIPTION, orEmpty(article.description()));
        fields.put(URL, orEmpty(article.url()));
        fields.put(IMAGE_URL, orEmpty(article.imageUrl()));
        fields.put(PUBLISHED_AT, article.publishedAt() != null ? article.publishedAt().toString() : "");
        fields.put(CONTENT, orEmpty(article.content()));
        return fields;
    }

    public static Article fromFields(Map<String, String> fields) {
        return new Article(
                orNull(fields.get(KEYWORD)),
                orNull(fields.get(SOURCE)),
                orNull(fields.get(AUTHOR)),
                orNull(fields.get(TITLE)),
                orNull(fields.get(DESCRIPTION)),
                orNull(fields.get(URL)),
                orNull(fields.get(IMAGE_URL)),
                parseInstant(fields.get(PUBLISHED_AT)),
                orNull(fields.get(CONTENT))
        );
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String orNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
