package io.flare.mentions.api.service.stream;

import java.time.Duration;

/**
 * An entry delivered to {@code consumer} but not yet acknowledged.
 */
public record PendingEntry(
        String id,
        String consumer,
        Duration idle,
        long deliveryCount
) {}
