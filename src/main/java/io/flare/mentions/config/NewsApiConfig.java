package io.flare.mentions.config;

public record NewsApiConfig(
        String endpoint,
        String apiKey,
        String language,
        String sortBy,
        int pageSize,
        HttpConfig http
) {}
