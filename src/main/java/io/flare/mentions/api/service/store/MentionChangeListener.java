package io.flare.mentions.api.service.store;

import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.dto.kafka.MentionChangedEvent.ChangeType;

/**
 * Receives every successful write to the mention store, for realtime fan-out.
 */
@FunctionalInterface
public interface MentionChangeListener {

    void onMentionChanged(ChangeType changeType, Mention mention);
}
