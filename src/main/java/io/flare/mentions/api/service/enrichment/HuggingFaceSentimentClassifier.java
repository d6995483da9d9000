package io.flare.mentions.api.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flare.mentions.api.dto.SentimentLabel;
import io.flare.mentions.api.dto.SentimentResult;
import io.flare.mentions.api.exception.ClassifierTerminalException;
import io.flare.mentions.api.exception.ClassifierTransientException;
import io.flare.mentions.api.exception.ErrorCategory;
import io.flare.mentions.config.ClassifierConfig;
import io.flare.mentions.config.MentionsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Sentiment classification through a Hugging Face inference endpoint.
 * <p>
 * Text-classification models answer either {@code [[{"label":..,"score":..}, ...]]} or
 * {@code [{"label":..,"score":..}, ...]}; the highest-scoring label wins.
 */
@Component
public class HuggingFaceSentimentClassifier implements SentimentClassifier {

    private static final Logger logger = LoggerFactory.getLogger(HuggingFaceSentimentClassifier.class);

    private final ClassifierConfig config;
    private final ObjectMapper objectMapper;

    public HuggingFaceSentimentClassifier(MentionsConfig mentionsConfig, ObjectMapper objectMapper) {
        this.config = mentionsConfig.classifier();
        this.objectMapper = objectMapper;
    }

    @Override
    public SentimentResult classify(String text) {
        HttpURLConnection connection = null;

        try {
            connection = (HttpURLConnection) URI.create(config.endpoint()).toURL().openConnection();
            configureConnection(connection);

            byte[] payload = objectMapper.writeValueAsBytes(Map.of("inputs", text));
            try (OutputStream out = connection.getOutputStream()) {
                out.write(payload);
            }

            int status = connection.getResponseCode();
            if (status < 200 || status >= 300) {
                throw errorFor(status, readError(connection));
            }

            try (InputStream in = connection.getInputStream()) {
                return parseResponse(objectMapper.readTree(in));
            }

        } catch (JsonProcessingException e) {
            throw new ClassifierTerminalException("Unparseable classifier response: " + e.getOriginalMessage(), e,
                    ErrorCategory.PARSE_ERROR);

        } catch (IOException e) {
            throw new ClassifierTransientException("Classifier call failed: " + e.getMessage(), e,
                    ErrorCategory.fromIOException(e));

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private void configureConnection(HttpURLConnection connection) throws IOException {
        connection.setConnectTimeout(config.http().getConnectTimeoutMs());
        connection.setReadTimeout(config.http().getReadTimeoutMs());
        connection.setRequestMethod("POST");

        connection.setRequestProperty("User-Agent", config.http().userAgent());
        connection.setRequestProperty("Content-Type", "application/json");
        connection.setRequestProperty("Accept", "application/json");
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            connection.setRequestProperty("Authorization", "Bearer " + config.apiKey());
        }

        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(true);
    }

    SentimentResult parseResponse(JsonNode response) {
        JsonNode best = findBestPrediction(response);
        if (best == null) {
            throw new ClassifierTerminalException("Classifier response has no predictions: " + response,
                    ErrorCategory.PARSE_ERROR);
        }

        String label = best.path("label").asText();
        SentimentLabel sentiment = SentimentLabel.fromProviderLabel(label)
                .orElseThrow(() -> new ClassifierTerminalException("Unknown sentiment label: " + label,
                        ErrorCategory.PARSE_ERROR));

        return new SentimentResult(sentiment, best.path("score").asDouble());
    }

    private JsonNode findBestPrediction(JsonNode node) {
        if (node == null) return null;

        if (node.isObject() && node.has("label")) {
            return node;
        }

        JsonNode best = null;
        if (node.isArray()) {
            for (JsonNode child : node) {
                JsonNode candidate = findBestPrediction(child);
                if (candidate != null
                        && (best == null || candidate.path("score").asDouble() > best.path("score").asDouble())) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    private RuntimeException errorFor(int status, String body) {
        ErrorCategory category = ErrorCategory.fromHttpStatus(status);
        String message = String.format("Classifier returned HTTP %d: %s", status, body);

        if (category.isTransient()) {
            logger.debug("Transient classifier failure ({}): {}", category, body);
            return new ClassifierTransientException(message, category);
        }
        return new ClassifierTerminalException(message, category);
    }

    private static String readError(HttpURLConnection connection) {
        try (InputStream err = connection.getErrorStream()) {
            return err != null ? new String(err.readAllBytes(), StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            return "<unreadable error body: " + e.getMessage() + ">";
        }
    }
}
