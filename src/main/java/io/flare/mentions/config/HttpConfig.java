package io.flare.mentions.config;

import java.time.Duration;

public record HttpConfig(
        Duration connectTimeout,
        Duration readTimeout,
        String userAgent
) {
    public int getConnectTimeoutMs() {
        return (int) connectTimeout.toMillis();
    }

    public int getReadTimeoutMs() {
        return (int) readTimeout.toMillis();
    }
}
