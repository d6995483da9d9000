package io.flare.mentions.api.service.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flare.mentions.api.exception.ErrorCategory;
import io.flare.mentions.api.exception.UpstreamQuotaExceededException;
import io.flare.mentions.api.exception.UpstreamUnavailableException;
import io.flare.mentions.config.MentionsConfig;
import io.flare.mentions.config.NewsApiConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 * NewsAPI {@code /v2/everything} client.
 */
@Component
public class NewsApiClient implements ArticleSearchClient {

    private static final Logger logger = LoggerFactory.getLogger(NewsApiClient.class);

    private static final String RATE_LIMITED_CODE = "rateLimited";

    private final NewsApiConfig config;
    private final ObjectMapper objectMapper;

    public NewsApiClient(MentionsConfig mentionsConfig, ObjectMapper objectMapper) {
        this.config = mentionsConfig.newsApi();
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode search(String keyword) {
        String url = buildUrl(keyword);
        HttpURLConnection connection = null;

        try {
            connection = (HttpURLConnection) URI.create(url).toURL().openConnection();
            configureConnection(connection);

            int status = connection.getResponseCode();
            String body = readBody(connection, status);

            if (status >= 200 && status < 300) {
                JsonNode json = parse(body, keyword);
                checkProviderStatus(json, keyword);
                return json;
            }

            throw errorFor(status, body, keyword);

        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new UpstreamUnavailableException("Invalid search URL for keyword '" + keyword + "'", e,
                    ErrorCategory.INVALID_REQUEST);

        } catch (IOException e) {
            ErrorCategory category = ErrorCategory.fromIOException(e);
            throw new UpstreamUnavailableException("Search request failed for '" + keyword + "': "
                    + e.getMessage(), e, category);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private String buildUrl(String keyword) {
        return config.endpoint()
                + "?q=" + encode(keyword)
                + "&language=" + encode(config.language())
                + "&sortBy=" + encode(config.sortBy())
                + "&pageSize=" + config.pageSize();
    }

    private void configureConnection(HttpURLConnection connection) {
        connection.setConnectTimeout(config.http().getConnectTimeoutMs());
        connection.setReadTimeout(config.http().getReadTimeoutMs());

        connection.setRequestProperty("User-Agent", config.http().userAgent());
        connection.setRequestProperty("Accept", "application/json");
        connection.setRequestProperty("Accept-Encoding", "gzip");
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            connection.setRequestProperty("X-Api-Key", config.apiKey());
        }

        connection.setInstanceFollowRedirects(true);
        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(false);
    }

    private String readBody(HttpURLConnection connection, int status) throws IOException {
        InputStream inputStream = status >= 400 ? connection.getErrorStream() : connection.getInputStream();
        if (inputStream == null) return "";

        if ("gzip".equalsIgnoreCase(connection.getContentEncoding())) {
            inputStream = new GZIPInputStream(inputStream);
        }

        try (InputStream in = inputStream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private JsonNode parse(String body, String keyword) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("Unparseable search response for '" + keyword + "'", e,
                    ErrorCategory.PARSE_ERROR);
        }
    }

    private void checkProviderStatus(JsonNode json, String keyword) {
        if (json == null || !"error".equals(json.path("status").asText())) return;

        String code = json.path("code").asText();
        if (RATE_LIMITED_CODE.equals(code)) {
            throw new UpstreamQuotaExceededException("Provider rate limit reached for '" + keyword + "'");
        }
        throw new UpstreamUnavailableException("Provider error for '" + keyword + "': " + code + " "
                + json.path("message").asText(), ErrorCategory.HTTP_ERROR);
    }

    private RuntimeException errorFor(int status, String body, String keyword) {
        ErrorCategory category = ErrorCategory.fromHttpStatus(status);
        logger.debug("Search for '{}' returned {}: {}", keyword, status, body);

        if (category == ErrorCategory.RATE_LIMITED || body.contains("\"" + RATE_LIMITED_CODE + "\"")) {
            return new UpstreamQuotaExceededException("Provider rate limit reached for '" + keyword + "' (" + status + ")");
        }
        return new UpstreamUnavailableException(
                String.format("Search for '%s' failed with HTTP %d", keyword, status), category);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8);
    }
}
