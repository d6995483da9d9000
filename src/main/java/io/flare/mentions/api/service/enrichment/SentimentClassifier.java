package io.flare.mentions.api.service.enrichment;

import io.flare.mentions.api.dto.SentimentResult;

public interface SentimentClassifier {

    /**
     * @throws io.flare.mentions.api.exception.ClassifierTransientException when a later call may succeed
     * @throws io.flare.mentions.api.exception.ClassifierTerminalException when this input can never be classified
     */
    SentimentResult classify(String text);
}
