// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.migration.resilience.exception.StatisticsReportException;
import software.amazon.migration.resilience.retry.Durations;
import software.amazon.migration.resilience.retry.RetryCategory;

/**
 * Renders {@link StatisticsSnapshot}s for operators.
 *
 * <p>The log summary is meant for the end of a validation or migration run. The JSON form uses ISO-8601 strings for
 * durations and timestamps.
 */
public class StatisticsReporter {
    private final Logger logger;
    private final ObjectMapper mapper;

    public StatisticsReporter() {
        this(LoggerFactory.getLogger(StatisticsReporter.class));
    }

    public StatisticsReporter(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    /**
     * Logs a human-readable summary at INFO level.
     *
     * @param snapshot the statistics to summarize
     */
    public void logSummary(StatisticsSnapshot snapshot) {
        if (snapshot.totalCalls() == 0) {
            logger.info("No retry statistics available");
            return;
        }

        logger.info("Retry statistics");
        logger.info("Total API calls: {}", snapshot.totalCalls());
        logger.info("Success rate: {}%", String.format(Locale.ROOT, "%.1f", snapshot.successRate()));
        logger.info("Total retries: {}", snapshot.totalRetries());
        logger.info("Average retry delay: {}", formatSeconds(snapshot.averageDelay()));
        logger.info("Max retry delay: {}", formatSeconds(snapshot.maxDelay()));

        if (!snapshot.retriesByCategory().isEmpty()) {
            logger.info("Retry reasons:");
            for (var category : RetryCategory.values()) {
                var count = snapshot.retriesByCategory().get(category);
                if (count != null) {
                    logger.info("  {}: {}", category.name().toLowerCase(Locale.ROOT), count);
                }
            }
        }
    }

    /**
     * Serializes a snapshot to JSON.
     *
     * @param snapshot the statistics to serialize
     * @return JSON document
     * @throws StatisticsReportException if serialization fails
     */
    public String toJson(StatisticsSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new StatisticsReportException("Failed to serialize retry statistics", e);
        }
    }

    private static String formatSeconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2fs", Durations.toSeconds(duration));
    }
}
