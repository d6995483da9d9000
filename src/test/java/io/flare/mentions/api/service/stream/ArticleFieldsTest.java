package io.flare.mentions.api.service.stream;

import io.flare.mentions.api.dto.Article;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleFieldsTest {

    @Test
    void shouldWriteAbsentValuesAsEmptyStrings() {
        Article article = new Article("acme", "Unknown", "Unknown", "Title", "", null, null, null, "");

        Map<String, String> fields = ArticleFields.toFields(article);

        assertThat(fields).containsOnlyKeys("search_keyword", "source", "author", "title", "description", "url",
                "urlToImage", "publishedAt", "content");
        assertThat(fields.get("url")).isEmpty();
        assertThat(fields.get("publishedAt")).isEmpty();
    }

    @Test
    void shouldReadEmptyAndMissingValuesAsAbsent() {
        Article article = ArticleFields.fromFields(Map.of(
                "search_keyword", "acme",
                "title", "Title",
                "url", "",
                "publishedAt", "not-a-date"));

        assertThat(article.keyword()).isEqualTo("acme");
        assertThat(article.url()).isNull();
        assertThat(article.author()).isNull();
        assertThat(article.publishedAt()).isNull();
        assertThat(article.hasUrl()).isFalse();
    }
}
