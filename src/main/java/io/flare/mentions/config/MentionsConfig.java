package io.flare.mentions.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mentions")
public record MentionsConfig(
        IngestionConfig ingestion,
        StreamConfig stream,
        EnrichmentConfig enrichment,
        RetryConfig retry,
        NewsApiConfig newsApi,
        ClassifierConfig classifier
) {}
