package io.flare.mentions.api.service.stream;

import io.flare.mentions.api.dto.Article;
import io.flare.mentions.api.exception.LogAppendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StreamOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.flare.mentions.support.Articles.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisStreamLogTest {

    private static final String STREAM = "mentions_stream";
    private static final String GROUP = "mentions_processor_group";

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private StreamOperations<String, String, String> streamOps;

    @Captor
    private ArgumentCaptor<MapRecord<String, String, String>> recordCaptor;

    @Captor
    private ArgumentCaptor<Range<String>> rangeCaptor;

    private RedisStreamLog streamLog;

    @BeforeEach
    void setUp() {
        streamLog = new RedisStreamLog(redisTemplate);
    }

    @Test
    @DisplayName("Should append the article as a flat field map")
    void shouldAppendArticleFields() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        when(streamOps.add(ArgumentMatchers.<MapRecord<String, String, String>>any()))
                .thenReturn(RecordId.of("1714557600000-0"));

        String id = streamLog.append(STREAM, article("acme", "https://news.example/1", "Acme raises funding"));

        assertThat(id).isEqualTo("1714557600000-0");
        verify(streamOps).add(recordCaptor.capture());
        Map<String, String> fields = recordCaptor.getValue().getValue();
        assertThat(recordCaptor.getValue().getStream()).isEqualTo(STREAM);
        assertThat(fields)
                .containsEntry("search_keyword", "acme")
                .containsEntry("url", "https://news.example/1")
                .containsEntry("urlToImage", "")
                .containsEntry("publishedAt", "2024-05-01T10:00:00Z");
    }

    @Test
    @DisplayName("Should translate a Redis failure on append")
    void shouldWrapAppendFailure() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        when(streamOps.add(ArgumentMatchers.<MapRecord<String, String, String>>any()))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> streamLog.append(STREAM, article("acme", "https://news.example/1", "One")))
                .isInstanceOf(LogAppendException.class)
                .hasMessageContaining(STREAM);
    }

    @Test
    @DisplayName("Should read without blocking when the timeout is zero")
    void shouldReadEntriesForConsumer() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        MapRecord<String, String, String> record = StreamRecords.string(Map.of(
                        "search_keyword", "acme", "title", "One", "url", "", "publishedAt", "2024-05-01T10:00:00Z"))
                .withStreamKey(STREAM)
                .withId(RecordId.of("1-0"));
        when(streamOps.read(any(Consumer.class), any(StreamReadOptions.class), ArgumentMatchers.<StreamOffset<String>>any()))
                .thenReturn(List.of(record));

        List<StreamEntry> entries = streamLog.read(STREAM, GROUP, "consumer_1", 10, Duration.ZERO);

        assertThat(entries).hasSize(1);
        Article article = entries.get(0).article();
        assertThat(entries.get(0).id()).isEqualTo("1-0");
        assertThat(article.title()).isEqualTo("One");
        assertThat(article.url()).isNull();

        ArgumentCaptor<Consumer> consumer = ArgumentCaptor.forClass(Consumer.class);
        ArgumentCaptor<StreamReadOptions> options = ArgumentCaptor.forClass(StreamReadOptions.class);
        verify(streamOps).read(consumer.capture(), options.capture(), ArgumentMatchers.<StreamOffset<String>>any());
        assertThat(consumer.getValue().getGroup()).isEqualTo(GROUP);
        assertThat(consumer.getValue().getName()).isEqualTo("consumer_1");
        assertThat(options.getValue().isBlocking()).isFalse();
        assertThat(options.getValue().getCount()).isEqualTo(10L);
    }

    @Test
    @DisplayName("Should only report pending entries idle for at least the threshold")
    void shouldFilterPendingByIdleTime() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        PendingMessages messages = new PendingMessages(GROUP, List.of(
                new PendingMessage(RecordId.of("1-0"), Consumer.from(GROUP, "consumer_dead"), Duration.ofMinutes(5), 2),
                new PendingMessage(RecordId.of("2-0"), Consumer.from(GROUP, "consumer_busy"), Duration.ofSeconds(3), 1)));
        when(streamOps.pending(eq(STREAM), eq(GROUP), ArgumentMatchers.<Range<String>>any(), anyLong()))
                .thenReturn(messages);

        List<PendingEntry> idle = streamLog.pending(STREAM, GROUP, Duration.ofMinutes(1), 10);

        assertThat(idle).extracting(PendingEntry::id).containsExactly("1-0");
        assertThat(idle.get(0).deliveryCount()).isEqualTo(2);
        assertThat(idle.get(0).consumer()).isEqualTo("consumer_dead");
    }

    @Test
    @DisplayName("Should page past busy pending entries to find idle ones behind them")
    void shouldPagePendingEntries() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        List<PendingMessage> busy = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            busy.add(new PendingMessage(RecordId.of(i + "-0"), Consumer.from(GROUP, "consumer_busy"),
                    Duration.ofSeconds(3), 4));
        }
        PendingMessages firstPage = new PendingMessages(GROUP, busy);
        PendingMessages secondPage = new PendingMessages(GROUP, List.of(
                busy.get(99),
                new PendingMessage(RecordId.of("100-0"), Consumer.from(GROUP, "consumer_dead"), Duration.ofMinutes(5), 1)));
        when(streamOps.pending(eq(STREAM), eq(GROUP), ArgumentMatchers.<Range<String>>any(), anyLong()))
                .thenReturn(firstPage, secondPage);

        List<PendingEntry> idle = streamLog.pending(STREAM, GROUP, Duration.ofMinutes(1), 10);

        assertThat(idle).extracting(PendingEntry::id).containsExactly("100-0");
        verify(streamOps, times(2)).pending(eq(STREAM), eq(GROUP), rangeCaptor.capture(), eq(100L));
        assertThat(rangeCaptor.getAllValues().get(1).getLowerBound().getValue()).contains("99-0");
    }

    @Test
    @DisplayName("Should not renew an entry this consumer no longer owns")
    void shouldNotRenewForeignEntry() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        when(streamOps.pending(eq(STREAM), any(Consumer.class), ArgumentMatchers.<Range<String>>any(), anyLong()))
                .thenReturn(new PendingMessages(GROUP, List.of()));

        assertThat(streamLog.renew(STREAM, GROUP, "consumer_a", "1-0")).isFalse();
        verify(redisTemplate, never()).execute(ArgumentMatchers.<RedisCallback<List<RecordId>>>any());
    }

    @Test
    @DisplayName("Should renew an owned entry with an XCLAIM that the last peer claim would miss")
    void shouldRenewOwnedEntry() {
        doReturn(streamOps).when(redisTemplate).opsForStream();
        when(streamOps.pending(eq(STREAM), any(Consumer.class), ArgumentMatchers.<Range<String>>any(), anyLong()))
                .thenReturn(new PendingMessages(GROUP, List.of(new PendingMessage(RecordId.of("1-0"),
                        Consumer.from(GROUP, "consumer_a"), Duration.ofSeconds(70), 1))));
        when(redisTemplate.execute(ArgumentMatchers.<RedisCallback<List<RecordId>>>any()))
                .thenReturn(List.of(RecordId.of("1-0")));

        assertThat(streamLog.renew(STREAM, GROUP, "consumer_a", "1-0")).isTrue();

        ArgumentCaptor<Consumer> consumer = ArgumentCaptor.forClass(Consumer.class);
        verify(streamOps).pending(eq(STREAM), consumer.capture(), ArgumentMatchers.<Range<String>>any(), eq(1L));
        assertThat(consumer.getValue().getName()).isEqualTo("consumer_a");
    }

    @Test
    void shouldIgnoreExistingGroup() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisCallback<String>>any())).thenThrow(new RedisSystemException(
                "group exists", new IllegalStateException("BUSYGROUP Consumer Group name already exists")));

        assertThatCode(() -> streamLog.ensureGroup(STREAM, GROUP)).doesNotThrowAnyException();
    }

    @Test
    void shouldPropagateOtherGroupErrors() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisCallback<String>>any()))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> streamLog.ensureGroup(STREAM, GROUP))
                .isInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void shouldSkipEmptyBatch() {
        assertThat(streamLog.appendAll(STREAM, List.of())).isEmpty();
    }
}
