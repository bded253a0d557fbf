// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.stats;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.Logger;
import software.amazon.migration.resilience.retry.RetryCategory;

class StatisticsReporterTest {

    private Logger mockLogger;
    private StatisticsReporter reporter;

    @BeforeEach
    void setUp() {
        mockLogger = mock(Logger.class);
        reporter = new StatisticsReporter(mockLogger);
    }

    private static StatisticsSnapshot sampleSnapshot() {
        var statistics = new RetryStatistics();
        var timestamp = Instant.parse("2026-01-15T10:00:00Z");
        statistics.recordAttempt(
                new AttemptRecord(1, Duration.ofSeconds(1), RetryCategory.SERVICE_UNAVAILABLE, "HTTP 503", timestamp));
        statistics.recordAttempt(
                new AttemptRecord(1, Duration.ofSeconds(2), RetryCategory.THROTTLING, "Rate exceeded", timestamp));
        statistics.recordCallResult(true);
        statistics.recordCallResult(false);
        return statistics.snapshot();
    }

    @Test
    void logSummary_withNoCalls_shouldLogPlaceholder() {
        reporter.logSummary(new RetryStatistics().snapshot());

        verify(mockLogger).info("No retry statistics available");
        verifyNoMoreInteractions(mockLogger);
    }

    @Test
    void logSummary_withCalls_shouldLogTotalsAndReasons() {
        reporter.logSummary(sampleSnapshot());

        InOrder inOrder = inOrder(mockLogger);
        inOrder.verify(mockLogger).info("Retry statistics");
        inOrder.verify(mockLogger).info("Total API calls: {}", 2L);
        inOrder.verify(mockLogger).info("Success rate: {}%", "50.0");
        inOrder.verify(mockLogger).info("Total retries: {}", 2L);
        inOrder.verify(mockLogger).info("Average retry delay: {}", "1.50s");
        inOrder.verify(mockLogger).info("Max retry delay: {}", "2.00s");
        inOrder.verify(mockLogger).info("Retry reasons:");
        inOrder.verify(mockLogger).info("  {}: {}", "throttling", 1L);
        inOrder.verify(mockLogger).info("  {}: {}", "service_unavailable", 1L);
    }

    @Test
    void logSummary_withoutRetries_shouldSkipReasons() {
        var statistics = new RetryStatistics();
        statistics.recordCallResult(true);

        reporter.logSummary(statistics.snapshot());

        verify(mockLogger).info("Success rate: {}%", "100.0");
        verify(mockLogger, never()).info("Retry reasons:");
    }

    @Test
    void toJson_shouldRenderSnapshot() {
        var json = reporter.toJson(sampleSnapshot());

        assertTrue(json.contains("\"totalCalls\":2"), json);
        assertTrue(json.contains("\"successRate\":50.0"), json);
        assertTrue(json.contains("\"SERVICE_UNAVAILABLE\":1"), json);
        assertTrue(json.contains("\"maxDelay\":\"PT2S\""), json);
        assertTrue(json.contains("\"timestamp\":\"2026-01-15T10:00:00Z\""), json);
    }
}
