package io.flare.mentions.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.flare.mentions.api.dto.Mention;

import java.time.Instant;
import java.util.UUID;

public record MentionChangedEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("changeType") ChangeType changeType,
        @JsonProperty("mention") Mention mention,
        @JsonProperty("changedAt") Instant changedAt
) {
    public enum ChangeType {
        INSERT,
        UPDATE
    }

    public static MentionChangedEvent create(ChangeType changeType, Mention mention) {
        return new MentionChangedEvent(
                "CHG-" + UUID.randomUUID().toString().substring(0, 8),
                changeType, mention, Instant.now()
        );
    }
}
