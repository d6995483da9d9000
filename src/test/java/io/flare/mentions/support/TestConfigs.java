package io.flare.mentions.support;

import io.flare.mentions.config.BackoffConfig;
import io.flare.mentions.config.ClassifierConfig;
import io.flare.mentions.config.EnrichmentConfig;
import io.flare.mentions.config.HttpConfig;
import io.flare.mentions.config.IngestionConfig;
import io.flare.mentions.config.MentionsConfig;
import io.flare.mentions.config.NewsApiConfig;
import io.flare.mentions.config.NoiseFilterConfig;
import io.flare.mentions.config.RetryConfig;
import io.flare.mentions.config.StreamConfig;

import java.time.Duration;
import java.util.List;

public final class TestConfigs {

    public static final String STREAM_KEY = "mentions_stream";
    public static final String GROUP = "mentions_processor_group";

    private TestConfigs() {
    }

    public static MentionsConfig mentionsConfig() {
        return mentionsConfig(5, List.of("acme"), Duration.ofHours(6), true);
    }

    public static MentionsConfig mentionsConfig(int maxReclaims, List<String> keywords, Duration dedupWindow,
                                                boolean rawFastPath) {
        return mentionsConfig(maxReclaims, keywords, dedupWindow, rawFastPath, "http://localhost/search",
                "http://localhost/classify");
    }

    public static MentionsConfig mentionsConfig(int maxReclaims, List<String> keywords, Duration dedupWindow,
                                                boolean rawFastPath, String newsEndpoint, String classifierEndpoint) {
        HttpConfig http = new HttpConfig(Duration.ofSeconds(2), Duration.ofSeconds(2), "FlareMentions-Test/1.0");
        BackoffConfig fast = new BackoffConfig(Duration.ofMillis(1), Duration.ofMillis(5), 2.0, 0.2, 3);

        return new MentionsConfig(
                new IngestionConfig(keywords, Duration.ofMinutes(15), Duration.ofSeconds(30), true,
                        rawFastPath, dedupWindow),
                new StreamConfig(STREAM_KEY, GROUP, "consumer_", 10, Duration.ZERO, Duration.ofMinutes(1),
                        Duration.ofSeconds(30), Duration.ofMillis(10)),
                new EnrichmentConfig(true, 2, maxReclaims, 512, Duration.ofDays(1), Duration.ofSeconds(5),
                        new NoiseFilterConfig(false, 10, 20)),
                new RetryConfig(fast, fast),
                new NewsApiConfig(newsEndpoint, "test-key", "en", "relevancy", 20, http),
                new ClassifierConfig(classifierEndpoint, "hf-test-token", http)
        );
    }
}
