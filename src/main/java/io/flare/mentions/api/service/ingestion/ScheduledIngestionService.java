package io.flare.mentions.api.service.ingestion;

import io.flare.mentions.api.dto.IngestionResult;
import io.flare.mentions.config.IngestionConfig;
import io.flare.mentions.config.MentionsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScheduledIngestionService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledIngestionService.class);

    private final IngestionService ingestionService;
    private final IngestionConfig ingestionConfig;

    public ScheduledIngestionService(IngestionService ingestionService, MentionsConfig config) {
        this.ingestionService = ingestionService;
        this.ingestionConfig = config.ingestion();
    }

    @Scheduled(
            fixedRateString = "#{@ingestionProps.scheduleIntervalMs}",
            initialDelayString = "#{@ingestionProps.initialDelayMs}"
    )
    public void ingestAllKeywords() {
        if (!ingestionConfig.enableScheduling()) {
            logger.debug("Scheduled ingestion is disabled");
            return;
        }

        List<String> keywords = ingestionConfig.getActiveKeywords();
        if (keywords.isEmpty()) {
            logger.debug("No keywords configured, skipping scheduled ingestion");
            return;
        }

        logger.info("Starting scheduled ingestion for {} keywords", keywords.size());
        long startTime = System.currentTimeMillis();

        int totalFetched = 0;
        int totalAppended = 0;
        int abandoned = 0;

        for (String keyword : keywords) {
            try {
                IngestionResult result = ingestionService.ingest(keyword, IngestionService.TRIGGER_SCHEDULED);

                totalFetched += result.fetched();
                totalAppended += result.appended();
                if (result.outcome() == IngestionResult.Outcome.ABANDONED) {
                    abandoned++;
                }

            } catch (Exception e) {
                logger.error("Ingestion cycle for '{}' failed: {}", keyword, e.getMessage(), e);
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Scheduled ingestion completed: {} fetched, {} appended, {} keywords abandoned in {}ms",
                totalFetched, totalAppended, abandoned, duration);
    }
}
