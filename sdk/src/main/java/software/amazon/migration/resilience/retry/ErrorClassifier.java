// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.util.Objects;
import java.util.Optional;
import software.amazon.migration.resilience.RetryPolicy;
import software.amazon.migration.resilience.failure.FailureInspector;

/**
 * Decides whether a failure is transient and, if so, why.
 *
 * <p>Checks run from the most to the least reliable signal; the first match wins:
 *
 * <ol>
 *   <li>status code: 429 is throttling, 500/502/503/504 mean the service is unavailable, 408 is a timeout, and any
 *       other code listed in the policy is a generic transient error
 *   <li>exception type listed in the policy's retryable error kinds
 *   <li>message keywords from the policy's {@link ClassificationRules}
 *   <li>provider error code listed as transient in the classification rules
 * </ol>
 *
 * <p>A failure that matches nothing is not retryable. {@link Error}s are never retryable.
 */
public class ErrorClassifier {
    private final RetryPolicy policy;

    public ErrorClassifier(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    /**
     * Classifies a failure.
     *
     * @param failure the failure raised by the remote operation
     * @return the retry category, or empty if the failure must not be retried
     */
    public Optional<RetryCategory> classify(Throwable failure) {
        if (failure == null || failure instanceof Error) {
            return Optional.empty();
        }
        var details = FailureInspector.inspect(failure);

        if (details.statusCode().isPresent()) {
            var byStatus = classifyStatusCode(details.statusCode().getAsInt());
            if (byStatus.isPresent()) {
                return byStatus;
            }
        }

        if (policy.isRetryableErrorKind(failure)) {
            return Optional.of(RetryCategory.TRANSIENT_OTHER);
        }

        var rules = policy.classificationRules();
        var byMessage = rules.matchMessage(details.message());
        if (byMessage.isPresent()) {
            return byMessage;
        }

        if (details.errorCode().filter(rules::isTransientErrorCode).isPresent()) {
            return Optional.of(RetryCategory.TRANSIENT_OTHER);
        }

        return Optional.empty();
    }

    private Optional<RetryCategory> classifyStatusCode(int statusCode) {
        return switch (statusCode) {
            case 429 -> Optional.of(RetryCategory.THROTTLING);
            case 500, 502, 503, 504 -> Optional.of(RetryCategory.SERVICE_UNAVAILABLE);
            case 408 -> Optional.of(RetryCategory.TIMEOUT);
            default -> policy.retryableStatusCodes().contains(statusCode)
                    ? Optional.of(RetryCategory.TRANSIENT_OTHER)
                    : Optional.empty();
        };
    }
}
