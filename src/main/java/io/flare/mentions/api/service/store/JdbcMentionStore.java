package io.flare.mentions.api.service.store;

import io.flare.mentions.api.dto.Article;
import io.flare.mentions.api.dto.Mention;
import io.flare.mentions.api.dto.SentimentLabel;
import io.flare.mentions.api.dto.SentimentResult;
import io.flare.mentions.api.dto.kafka.MentionChangedEvent.ChangeType;
import io.flare.mentions.api.exception.StoreRejectedException;
import io.flare.mentions.api.exception.StoreUnavailableException;
import io.flare.mentions.api.exception.StoreWriteConflictException;
import io.flare.mentions.api.service.stream.StreamEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL mention store. Uniqueness comes from the {@code (keyword, dedup_key)} constraint and
 * {@code INSERT ... ON CONFLICT}, so concurrent writers for the same key need no coordination.
 */
@Repository
public class JdbcMentionStore implements MentionStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcMentionStore.class);

    private static final String ARTICLE_COLUMNS = """
            keyword, url, dedup_key, source, author, title, description, "urlToImage",
            published_at, content, stream_entry_id""";

    private static final String ARTICLE_VALUES = """
            :keyword, :url, :dedupKey, :source, :author, :title, :description, :imageUrl,
            :publishedAt, :content, :streamEntryId""";

    private static final String INSERT_RAW = "INSERT INTO mentions (" + ARTICLE_COLUMNS + ")"
            + " VALUES (" + ARTICLE_VALUES + ")"
            + " ON CONFLICT (keyword, dedup_key) DO NOTHING"
            + " RETURNING *";

    private static final String UPSERT_ENRICHED = "INSERT INTO mentions (" + ARTICLE_COLUMNS
            + ", sentiment_label, sentiment_score, enriched_at)"
            + " VALUES (" + ARTICLE_VALUES + ", :sentimentLabel, :sentimentScore, :enrichedAt)"
            + " ON CONFLICT (keyword, dedup_key) DO UPDATE SET"
            + " sentiment_label = EXCLUDED.sentiment_label,"
            + " sentiment_score = EXCLUDED.sentiment_score,"
            + " enriched_at = EXCLUDED.enriched_at"
            + " RETURNING *, (xmax = 0) AS inserted";

    private static final String SELECT_BY_KEY =
            "SELECT * FROM mentions WHERE keyword = :keyword AND dedup_key = :dedupKey";

    private static final String SELECT_BY_KEYWORD =
            "SELECT * FROM mentions WHERE keyword = :keyword ORDER BY published_at DESC NULLS LAST, id DESC";

    private static final String SELECT_LEADS =
            "SELECT * FROM mentions WHERE lead = TRUE ORDER BY published_at DESC NULLS LAST, id DESC";

    private static final RowMapper<Mention> MENTION_ROW_MAPPER = (rs, rowNum) -> mapMention(rs);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final RetryTemplate retryTemplate;
    private final MentionChangeListener changeListener;

    public JdbcMentionStore(NamedParameterJdbcTemplate jdbcTemplate,
                            @Qualifier("storeRetryTemplate") RetryTemplate retryTemplate,
                            MentionChangeListener changeListener) {
        this.jdbcTemplate = jdbcTemplate;
        this.retryTemplate = retryTemplate;
        this.changeListener = changeListener;
    }

    @Override
    public Mention upsertRaw(StreamEntry entry) {
        MentionKey key = MentionKey.of(entry);
        MapSqlParameterSource params = articleParams(entry, key);

        List<Mention> inserted = write("upsertRaw " + entry.id(),
                () -> jdbcTemplate.query(INSERT_RAW, params, MENTION_ROW_MAPPER));

        if (inserted.isEmpty()) {
            logger.debug("Mention already present for {} / {}, raw upsert is a no-op", key.keyword(), key.dedupKey());
            return findByKey(key).orElseThrow(() -> new IllegalStateException(
                    "Conflicting mention row vanished for " + key));
        }

        Mention mention = inserted.get(0);
        logger.debug("Inserted raw mention {} for entry {}", mention.id(), entry.id());
        changeListener.onMentionChanged(ChangeType.INSERT, mention);
        return mention;
    }

    @Override
    public Mention upsertEnriched(StreamEntry entry, SentimentResult sentiment, Instant enrichedAt) {
        MentionKey key = MentionKey.of(entry);
        MapSqlParameterSource params = articleParams(entry, key)
                .addValue("sentimentLabel", sentiment.label().name())
                .addValue("sentimentScore", sentiment.score())
                .addValue("enrichedAt", Timestamp.from(enrichedAt));

        UpsertOutcome outcome = write("upsertEnriched " + entry.id(),
                () -> jdbcTemplate.queryForObject(UPSERT_ENRICHED, params,
                        (rs, rowNum) -> new UpsertOutcome(mapMention(rs), rs.getBoolean("inserted"))));

        ChangeType changeType = outcome.inserted() ? ChangeType.INSERT : ChangeType.UPDATE;
        logger.debug("{} enriched mention {} ({} {})", changeType, outcome.mention().id(),
                sentiment.label(), sentiment.score());
        changeListener.onMentionChanged(changeType, outcome.mention());
        return outcome.mention();
    }

    @Override
    public Optional<Mention> findByKey(MentionKey key) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("keyword", key.keyword())
                .addValue("dedupKey", key.dedupKey());

        return jdbcTemplate.query(SELECT_BY_KEY, params, MENTION_ROW_MAPPER).stream().findFirst();
    }

    @Override
    public List<Mention> findByKeyword(String keyword) {
        return jdbcTemplate.query(SELECT_BY_KEYWORD, new MapSqlParameterSource("keyword", keyword), MENTION_ROW_MAPPER);
    }

    @Override
    public List<Mention> findLeads() {
        return jdbcTemplate.query(SELECT_LEADS, new MapSqlParameterSource(), MENTION_ROW_MAPPER);
    }

    private <T> T write(String operation, Supplier<T> statement) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                logger.warn("Retrying {} (attempt {}): {}", operation, context.getRetryCount() + 1,
                        context.getLastThrowable().getMessage());
            }
            try {
                return statement.get();

            } catch (ConcurrencyFailureException e) {
                throw new StoreWriteConflictException("Write conflict during " + operation, e);

            } catch (TransientDataAccessException | RecoverableDataAccessException
                     | DataAccessResourceFailureException e) {
                throw new StoreUnavailableException("Store unavailable during " + operation, e);

            } catch (NonTransientDataAccessException e) {
                throw new StoreRejectedException("Store rejected " + operation, e);
            }
        });
    }

    private static MapSqlParameterSource articleParams(StreamEntry entry, MentionKey key) {
        Article article = entry.article();
        return new MapSqlParameterSource()
                .addValue("keyword", key.keyword())
                .addValue("url", article.hasUrl() ? article.url() : null)
                .addValue("dedupKey", key.dedupKey())
                .addValue("source", article.sourceName())
                .addValue("author", article.author())
                .addValue("title", article.title())
                .addValue("description", article.description())
                .addValue("imageUrl", article.imageUrl())
                .addValue("publishedAt", article.publishedAt() != null ? Timestamp.from(article.publishedAt()) : null)
                .addValue("content", article.content())
                .addValue("streamEntryId", entry.id());
    }

    private static Mention mapMention(ResultSet rs) throws SQLException {
        String label = rs.getString("sentiment_label");
        double score = rs.getDouble("sentiment_score");
        Double sentimentScore = rs.wasNull() ? null : score;

        return new Mention(
                rs.getLong("id"),
                rs.getString("keyword"),
                rs.getString("url"),
                rs.getString("source"),
                rs.getString("author"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("urlToImage"),
                toInstant(rs.getTimestamp("published_at")),
                rs.getString("content"),
                label != null ? SentimentLabel.valueOf(label) : null,
                sentimentScore,
                rs.getBoolean("lead"),
                rs.getString("note"),
                rs.getString("stream_entry_id"),
                toInstant(rs.getTimestamp("inserted_at")),
                toInstant(rs.getTimestamp("enriched_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private record UpsertOutcome(Mention mention, boolean inserted) {}
}
