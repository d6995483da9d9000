package io.flare.mentions.config;

import java.time.Duration;
import java.util.List;

public record IngestionConfig(
        List<String> keywords,
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling,
        boolean rawFastPath,
        Duration dedupWindow
) {
    public List<String> getActiveKeywords() {
        if (keywords == null) return List.of();

        return keywords.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    public boolean isDedupEnabled() {
        return dedupWindow != null && !dedupWindow.isZero() && !dedupWindow.isNegative();
    }

    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
