package io.flare.mentions.api.service.stream;

import io.flare.mentions.api.dto.Article;
import io.flare.mentions.api.exception.LogAppendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStreamCommands.XClaimOptions;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link StreamLog} on Redis Streams (XADD, XREADGROUP, XACK, XPENDING, XCLAIM).
 */
@Service
public class RedisStreamLog implements StreamLog {

    private static final Logger logger = LoggerFactory.getLogger(RedisStreamLog.class);

    private static final long PENDING_PAGE_SIZE = 100;

    private final RedisTemplate<String, String> redisTemplate;

    public RedisStreamLog(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public String append(String streamKey, Article article) {
        try {
            RecordId id = streamOps().add(StreamRecords.string(ArticleFields.toFields(article)).withStreamKey(streamKey));
            if (id == null) {
                throw new LogAppendException("Redis returned no entry id for append to " + streamKey);
            }
            return id.getValue();

        } catch (DataAccessException e) {
            throw new LogAppendException("Failed to append to stream " + streamKey + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> appendAll(String streamKey, List<Article> articles) {
        if (articles.isEmpty()) return List.of();

        List<Object> results;
        try {
            results = redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    StreamOperations<String, String, String> streams = ops.opsForStream();

                    ops.multi();
                    for (Article article : articles) {
                        streams.add(StreamRecords.string(ArticleFields.toFields(article)).withStreamKey(streamKey));
                    }
                    return ops.exec();
                }
            });
        } catch (DataAccessException e) {
            throw new LogAppendException("Failed to append batch of " + articles.size()
                    + " to stream " + streamKey + ": " + e.getMessage(), e);
        }

        if (results == null || results.size() != articles.size()) {
            throw new LogAppendException("Batch append to " + streamKey + " was not committed ("
                    + (results == null ? 0 : results.size()) + "/" + articles.size() + " results)");
        }

        List<String> ids = new ArrayList<>(results.size());
        for (Object result : results) {
            ids.add(result instanceof RecordId recordId ? recordId.getValue() : String.valueOf(result));
        }

        logger.debug("Appended {} entries to {} ({} .. {})", ids.size(), streamKey, ids.get(0), ids.get(ids.size() - 1));
        return ids;
    }

    @Override
    public void ensureGroup(String streamKey, String consumerGroup) {
        byte[] key = streamKey.getBytes(StandardCharsets.UTF_8);
        try {
            redisTemplate.execute((RedisCallback<String>) connection -> createGroup(connection, key, consumerGroup));
            logger.info("Created consumer group '{}' on stream '{}'", consumerGroup, streamKey);

        } catch (DataAccessException e) {
            String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
            if (reason != null && reason.contains("BUSYGROUP")) {
                logger.debug("Consumer group '{}' already exists on '{}'", consumerGroup, streamKey);
                return;
            }
            throw e;
        }
    }

    private static String createGroup(RedisConnection connection, byte[] key, String consumerGroup) {
        return connection.streamCommands().xGroupCreate(key, consumerGroup, ReadOffset.from("0"), true);
    }

    @Override
    public List<StreamEntry> read(String streamKey, String consumerGroup, String consumerId,
                                  int count, Duration blockTimeout) {
        StreamReadOptions options = StreamReadOptions.empty().count(count);
        if (blockTimeout != null && !blockTimeout.isZero() && !blockTimeout.isNegative()) {
            options = options.block(blockTimeout);
        }

        List<MapRecord<String, String, String>> records = streamOps().read(
                Consumer.from(consumerGroup, consumerId),
                options,
                StreamOffset.create(streamKey, ReadOffset.lastConsumed())
        );

        return toEntries(records);
    }

    @Override
    public void ack(String streamKey, String consumerGroup, String entryId) {
        Long acknowledged = streamOps().acknowledge(streamKey, consumerGroup, entryId);
        if (acknowledged == null || acknowledged == 0) {
            logger.debug("Entry {} was already acknowledged for group {}", entryId, consumerGroup);
        }
    }

    @Override
    public List<PendingEntry> pending(String streamKey, String consumerGroup, Duration idleThreshold, int limit) {
        List<PendingEntry> idle = new ArrayList<>();
        Range<String> range = Range.unbounded();
        String lastSeen = null;

        // XPENDING lists oldest ids first, busy ones included
        while (idle.size() < limit) {
            PendingMessages page = streamOps().pending(streamKey, consumerGroup, range, PENDING_PAGE_SIZE);
            if (page == null || page.isEmpty()) break;

            for (PendingMessage message : page) {
                if (message.getIdAsString().equals(lastSeen)) continue;

                Duration elapsed = message.getElapsedTimeSinceLastDelivery();
                if (elapsed.compareTo(idleThreshold) >= 0) {
                    idle.add(new PendingEntry(message.getIdAsString(), message.getConsumerName(),
                            elapsed, message.getTotalDeliveryCount()));
                    if (idle.size() == limit) break;
                }
            }

            if (page.size() < PENDING_PAGE_SIZE) break;
            lastSeen = page.get(page.size() - 1).getIdAsString();
            range = Range.rightUnbounded(Range.Bound.inclusive(lastSeen));
        }
        return idle;
    }

    @Override
    public List<StreamEntry> claim(String streamKey, String consumerGroup, String consumerId,
                                   Duration idleThreshold, List<String> entryIds) {
        if (entryIds.isEmpty()) return List.of();

        RecordId[] ids = entryIds.stream().map(RecordId::of).toArray(RecordId[]::new);
        List<MapRecord<String, String, String>> records =
                streamOps().claim(streamKey, consumerGroup, consumerId, idleThreshold, ids);

        return toEntries(records);
    }

    @Override
    public boolean renew(String streamKey, String consumerGroup, String consumerId, String entryId) {
        PendingMessages owned = streamOps().pending(streamKey, Consumer.from(consumerGroup, consumerId),
                Range.closed(entryId, entryId), 1L);
        if (owned == null || owned.isEmpty()) return false;

        // a peer claim in between resets the idle time below the value just read, and the XCLAIM misses
        Duration idle = owned.get(0).getElapsedTimeSinceLastDelivery();
        byte[] key = streamKey.getBytes(StandardCharsets.UTF_8);
        List<RecordId> renewed = redisTemplate.execute((RedisCallback<List<RecordId>>) connection ->
                connection.streamCommands().xClaimJustId(key, consumerGroup, consumerId,
                        XClaimOptions.minIdle(idle).ids(RecordId.of(entryId))));

        return renewed != null && !renewed.isEmpty();
    }

    private StreamOperations<String, String, String> streamOps() {
        return redisTemplate.opsForStream();
    }

    private static List<StreamEntry> toEntries(List<MapRecord<String, String, String>> records) {
        if (records == null || records.isEmpty()) return List.of();

        return records.stream()
                .map(record -> new StreamEntry(record.getId().getValue(), ArticleFields.fromFields(record.getValue())))
                .toList();
    }
}
