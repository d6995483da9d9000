package io.flare.mentions.config;

import io.flare.mentions.api.exception.StoreUnavailableException;
import io.flare.mentions.api.exception.StoreWriteConflictException;
import io.flare.mentions.api.exception.UpstreamException;
import io.flare.mentions.api.util.JitteredExponentialBackOffPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.Map;

@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries a provider fetch on {@link UpstreamException} (unavailable or quota exceeded).
     */
    @Bean
    public RetryTemplate sourceRetryTemplate(MentionsConfig config) {
        return retryTemplate(config.retry().source(), Map.of(UpstreamException.class, true));
    }

    /**
     * Retries a store write on transient database failures before the entry is left for redelivery.
     */
    @Bean
    public RetryTemplate storeRetryTemplate(MentionsConfig config) {
        return retryTemplate(config.retry().store(), Map.of(
                StoreUnavailableException.class, true,
                StoreWriteConflictException.class, true
        ));
    }

    public static RetryTemplate retryTemplate(BackoffConfig backoff,
                                              Map<Class<? extends Throwable>, Boolean> retryOn) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(backoff.maxAttempts(), retryOn, true));
        template.setBackOffPolicy(JitteredExponentialBackOffPolicy.from(backoff));
        return template;
    }
}
