// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.failure;

import java.util.Optional;
import java.util.OptionalInt;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.http.SdkHttpResponse;

/**
 * Extracts status code, provider error code and retry-after hint from a failure.
 *
 * <p>Understands {@link RemoteFailure} implementations and AWS SDK v2 service exceptions. Anything else only
 * contributes its message.
 */
public final class FailureInspector {
    static final String RETRY_AFTER_HEADER = "Retry-After";

    private FailureInspector() {}

    public static FailureDetails inspect(Throwable failure) {
        var message = failure.getMessage() != null ? failure.getMessage() : "";

        if (failure instanceof RemoteFailure remote) {
            return new FailureDetails(remote.statusCode(), remote.errorCode(), remote.retryAfter(), message);
        }

        if (failure instanceof SdkServiceException serviceException) {
            // the SDK reports 0 when no HTTP response was received
            var statusCode = serviceException.statusCode() > 0
                    ? OptionalInt.of(serviceException.statusCode())
                    : OptionalInt.empty();
            var errorDetails = failure instanceof AwsServiceException awsException
                    ? awsException.awsErrorDetails()
                    : null;
            return new FailureDetails(statusCode, errorCode(errorDetails), retryAfter(errorDetails), message);
        }

        return new FailureDetails(OptionalInt.empty(), Optional.empty(), Optional.empty(), message);
    }

    private static Optional<String> errorCode(AwsErrorDetails errorDetails) {
        if (errorDetails == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(errorDetails.errorCode());
    }

    private static Optional<String> retryAfter(AwsErrorDetails errorDetails) {
        if (errorDetails == null) {
            return Optional.empty();
        }
        SdkHttpResponse response = errorDetails.sdkHttpResponse();
        if (response == null) {
            return Optional.empty();
        }
        return response.firstMatchingHeader(RETRY_AFTER_HEADER);
    }
}
