// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.exception;

/**
 * Exception thrown when the calling thread is interrupted while waiting between attempts.
 *
 * <p>The cause is the {@link InterruptedException}. The failure that triggered the pending retry is attached as a
 * suppressed exception so it is not lost.
 */
public class RetryInterruptedException extends ResilienceException {
    private final int attemptNumber;
    private final String operationName;

    public RetryInterruptedException(
            String operationName, int attemptNumber, InterruptedException cause, Throwable pendingFailure) {
        super(formatMessage(operationName, attemptNumber), cause);
        this.attemptNumber = attemptNumber;
        this.operationName = operationName;
        if (pendingFailure != null) {
            addSuppressed(pendingFailure);
        }
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public String getOperationName() {
        return operationName;
    }

    private static String formatMessage(String operationName, int attemptNumber) {
        var message = String.format("Interrupted while waiting to retry after attempt %d", attemptNumber);
        if (operationName != null) {
            message += String.format(", Operation Name: %s", operationName);
        }
        return message;
    }
}
