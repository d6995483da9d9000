package io.flare.mentions.api.util;

import io.flare.mentions.config.MentionsConfig;
import org.springframework.stereotype.Component;

@Component
public class IngestionProps {
    private final long scheduleIntervalMs;
    private final long initialDelayMs;

    public IngestionProps(MentionsConfig config) {
        this.scheduleIntervalMs = config.ingestion().getScheduleIntervalMs();
        this.initialDelayMs = config.ingestion().getInitialDelayMs();
    }

    // schedule
    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
}
