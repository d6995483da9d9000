package io.flare.mentions.api;

import io.flare.mentions.api.dto.IngestionResult;
import io.flare.mentions.api.exception.LogAppendException;
import io.flare.mentions.api.service.ingestion.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/ingest")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @GetMapping
    public ResponseEntity<?> ingest(@RequestParam(required = false) String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "keyword is required"));
        }

        try {
            IngestionResult result = ingestionService.ingest(keyword, IngestionService.TRIGGER_MANUAL);
            return ResponseEntity.ok(result);

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));

        } catch (LogAppendException e) {
            logger.error("Manual ingestion for '{}' could not append to the stream: {}", keyword, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "error", "stream unavailable",
                    "category", e.getCategory().name(),
                    "keyword", keyword
            ));
        }
    }
}
