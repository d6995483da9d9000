package io.flare.mentions.api.service;

import io.flare.mentions.api.dto.IngestionResult;
import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.dto.SentimentLabel;
import io.flare.mentions.api.dto.kafka.IngestionBatchEvent;
import io.flare.mentions.api.dto.kafka.MentionChangedEvent;
import io.flare.mentions.api.dto.kafka.MentionChangedEvent.ChangeType;
import io.flare.mentions.config.KafkaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPublisherServiceTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private EventPublisherService service;

    @BeforeEach
    void setUp() {
        service = new EventPublisherService(kafkaTemplate, new KafkaProperties("test-mention-changed", "test-ingestion-batch"));
    }

    @Test
    @DisplayName("Should publish a mention change keyed by mention id")
    void shouldPublishMentionChanged() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        service.onMentionChanged(ChangeType.UPDATE, mention(42L));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-mention-changed"), eq("42"), captor.capture());
        MentionChangedEvent event = (MentionChangedEvent) captor.getValue();
        assertThat(event.changeType()).isEqualTo(ChangeType.UPDATE);
        assertThat(event.mention().sentimentLabel()).isEqualTo(SentimentLabel.POSITIVE);
    }

    @Test
    @DisplayName("Should publish an ingestion batch summary")
    void shouldPublishIngestionBatch() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        IngestionResult result = IngestionResult.appended("acme", 3, 1, List.of("1-0", "1-1"), 120);

        service.publishIngestionBatch("manual", result);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-ingestion-batch"), anyString(), captor.capture());
        IngestionBatchEvent event = (IngestionBatchEvent) captor.getValue();
        assertThat(event.keyword()).isEqualTo("acme");
        assertThat(event.fetchedArticles()).isEqualTo(3);
        assertThat(event.appendedArticles()).isEqualTo(2);
        assertThat(event.skippedDuplicates()).isEqualTo(1);
        assertThat(event.trigger()).isEqualTo("manual");
    }

    @Test
    @DisplayName("Should count completed and failed sends")
    void shouldTrackPublishingStats() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        service.onMentionChanged(ChangeType.INSERT, mention(1L));

        var stats = service.getStats();
        assertThat(stats.totalAttempts()).isEqualTo(1);
        assertThat(stats.totalFailed()).isEqualTo(1);
        assertThat(stats.getSuccessRate()).isZero();
    }

    @Test
    @DisplayName("Should never propagate a synchronous send failure")
    void shouldSwallowSendFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no metadata"));

        assertThatCode(() -> service.onMentionChanged(ChangeType.INSERT, mention(1L))).doesNotThrowAnyException();
        assertThat(service.getStats().totalFailed()).isEqualTo(1);
        assertThat(service.isHealthy()).isTrue();
    }

    private static Mention mention(Long id) {
        return new Mention(id, "acme", "https://news.example/1", "Example News", "Reporter", "Acme raises funding",
                "", null, Instant.parse("2024-05-01T10:00:00Z"), "", SentimentLabel.POSITIVE, 0.87, false, null,
                "1-0", Instant.parse("2024-05-01T10:01:00Z"), Instant.parse("2024-05-01T10:02:00Z"));
    }
}
