package io.flare.mentions.config;

import java.time.Duration;

public record EnrichmentConfig(
        boolean enabled,
        int workers,
        int maxReclaims,
        int inputLimit,
        Duration failureTtl,
        Duration shutdownTimeout,
        NoiseFilterConfig noiseFilter
) {
    public boolean isNoiseFilterEnabled() {
        return noiseFilter != null && noiseFilter.enabled();
    }
}
