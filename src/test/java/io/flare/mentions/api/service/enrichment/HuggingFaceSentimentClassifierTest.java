package io.flare.mentions.api.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.flare.mentions.api.dto.SentimentLabel;
import io.flare.mentions.api.dto.SentimentResult;
import io.flare.mentions.api.exception.ClassifierTerminalException;
import io.flare.mentions.api.exception.ClassifierTransientException;
import io.flare.mentions.api.exception.ErrorCategory;
import io.flare.mentions.support.TestConfigs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HuggingFaceSentimentClassifierTest {

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance().build();

    private HuggingFaceSentimentClassifier classifier;

    @BeforeEach
    void setUp() {
        var config = TestConfigs.mentionsConfig(5, List.of("acme"), Duration.ofHours(6), true,
                wireMock.baseUrl() + "/search", wireMock.baseUrl() + "/models/sst-2");
        classifier = new HuggingFaceSentimentClassifier(config, new ObjectMapper());
    }

    @Test
    @DisplayName("Should pick the highest scoring label from a nested response")
    void shouldClassifyText() {
        wireMock.stubFor(post(urlEqualTo("/models/sst-2"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("[[{\"label\":\"NEGATIVE\",\"score\":0.13},{\"label\":\"POSITIVE\",\"score\":0.87}]]")));

        SentimentResult result = classifier.classify("Acme raises funding");

        assertThat(result.label()).isEqualTo(SentimentLabel.POSITIVE);
        assertThat(result.score()).isEqualTo(0.87);
        wireMock.verify(postRequestedFor(urlEqualTo("/models/sst-2"))
                .withHeader("Authorization", equalTo("Bearer hf-test-token"))
                .withRequestBody(equalToJson("{\"inputs\":\"Acme raises funding\"}")));
    }

    @Test
    @DisplayName("Should treat a loading model as a transient failure")
    void shouldMapServiceUnavailableToTransient() {
        wireMock.stubFor(post(urlEqualTo("/models/sst-2"))
                .willReturn(aResponse().withStatus(503).withBody("{\"error\":\"Model is currently loading\"}")));

        assertThatThrownBy(() -> classifier.classify("text"))
                .isInstanceOf(ClassifierTransientException.class)
                .extracting(e -> ((ClassifierTransientException) e).getCategory())
                .isEqualTo(ErrorCategory.SERVER_UNAVAILABLE);
    }

    @Test
    @DisplayName("Should treat a rejected input as a terminal failure")
    void shouldMapBadRequestToTerminal() {
        wireMock.stubFor(post(urlEqualTo("/models/sst-2"))
                .willReturn(aResponse().withStatus(400).withBody("{\"error\":\"bad input\"}")));

        assertThatThrownBy(() -> classifier.classify("text"))
                .isInstanceOf(ClassifierTerminalException.class);
    }

    @Test
    @DisplayName("Should reject a response without a usable label")
    void shouldRejectUnknownLabel() {
        wireMock.stubFor(post(urlEqualTo("/models/sst-2"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("[{\"label\":\"LABEL_7\",\"score\":0.99}]")));

        assertThatThrownBy(() -> classifier.classify("text"))
                .isInstanceOf(ClassifierTerminalException.class)
                .hasMessageContaining("LABEL_7");
    }
}
