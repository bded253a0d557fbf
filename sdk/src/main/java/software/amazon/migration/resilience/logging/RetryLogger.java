// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;
import software.amazon.migration.resilience.retry.Durations;
import software.amazon.migration.resilience.retry.RetryCategory;
import software.amazon.migration.resilience.stats.AttemptRecord;
import software.amazon.migration.resilience.util.ExceptionHelper;

/**
 * Logger wrapper that emits the advisory retry notices and adds the operation name, attempt number and retry category
 * to each entry via MDC.
 */
public class RetryLogger {
    static final String MDC_OPERATION_NAME = "operationName";
    static final String MDC_ATTEMPT = "attempt";
    static final String MDC_RETRY_CATEGORY = "retryCategory";

    private final Logger delegate;
    private final String operationName;

    public RetryLogger(Logger delegate, String operationName) {
        this.delegate = delegate;
        this.operationName = operationName;
    }

    /** @return a logger sharing this logger's delegate but tagging entries with another operation name */
    public RetryLogger forOperation(String operationName) {
        return new RetryLogger(delegate, operationName);
    }

    public String getOperationName() {
        return operationName;
    }

    public void retryScheduled(AttemptRecord attempt, int maxAttempts) {
        log(
                attempt.attemptNumber(),
                attempt.category(),
                () -> delegate.warn(
                        "{} - Retrying in {} (attempt {}/{}), reason: {}",
                        attempt.category().notice(),
                        Durations.format(attempt.delay()),
                        attempt.attemptNumber(),
                        maxAttempts,
                        attempt.failureMessage()));
    }

    public void recovered(int attemptNumber) {
        log(
                attemptNumber,
                null,
                () -> delegate.info("Operation succeeded after {} retry attempt(s)", attemptNumber - 1));
    }

    public void exhausted(int maxAttempts, Throwable failure) {
        log(
                maxAttempts,
                null,
                () -> delegate.warn(
                        "Operation failed after {} attempts: {}", maxAttempts, ExceptionHelper.describe(failure)));
    }

    public void notRetryable(int attemptNumber, Throwable failure) {
        log(
                attemptNumber,
                null,
                () -> delegate.debug(
                        "Failure on attempt {} is not retryable: {}",
                        attemptNumber,
                        ExceptionHelper.describe(failure)));
    }

    public void interrupted(int attemptNumber) {
        log(attemptNumber, null, () -> delegate.warn("Interrupted while waiting to retry attempt {}", attemptNumber));
    }

    private void log(int attemptNumber, RetryCategory category, Runnable logAction) {
        try {
            if (operationName != null) {
                MDC.put(MDC_OPERATION_NAME, operationName);
            }
            MDC.put(MDC_ATTEMPT, String.valueOf(attemptNumber));
            if (category != null) {
                MDC.put(MDC_RETRY_CATEGORY, category.name());
            }

            logAction.run();
        } finally {
            MDC.remove(MDC_OPERATION_NAME);
            MDC.remove(MDC_ATTEMPT);
            MDC.remove(MDC_RETRY_CATEGORY);
        }
    }
}
