package io.flare.mentions.config;

/**
 * Drops articles whose title or description is too short to classify meaningfully. Off by default.
 */
public record NoiseFilterConfig(
        boolean enabled,
        int minTitleLength,
        int minDescriptionLength
) {}
