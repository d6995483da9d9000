package io.flare.mentions.api.service.ingestion;

import io.flare.mentions.api.dto.Article;
import io.flare.mentions.config.MentionsConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Remembers which keyword/url pairs were appended recently so repeated fetches of the same
 * search results do not flood the stream. Articles without url are never considered seen.
 */
@Service
public class IngestDeduplicationService {

    private static final String SEEN_PREFIX = "mentions:seen:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration window;

    public IngestDeduplicationService(RedisTemplate<String, String> redisTemplate, MentionsConfig config) {
        this.redisTemplate = redisTemplate;
        this.window = config.ingestion().dedupWindow();
    }

    public boolean isAlreadyIngested(Article article) {
        if (!article.hasUrl()) return false;

        return Boolean.TRUE.equals(redisTemplate.hasKey(generateKey(article)));
    }

    public void markAsIngested(Article article) {
        if (!article.hasUrl()) return;

        redisTemplate.opsForValue().set(generateKey(article), Instant.now().toString(), window);
    }

    public void removeIngestedMark(Article article) {
        if (!article.hasUrl()) return;

        redisTemplate.delete(generateKey(article));
    }

    String generateKey(Article article) {
        return SEEN_PREFIX + DigestUtils.md5Hex(article.keyword() + "|" + article.url());
    }
}
