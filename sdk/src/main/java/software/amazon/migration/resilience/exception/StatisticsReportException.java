// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.exception;

/** Exception thrown when retry statistics cannot be rendered as a report. */
public class StatisticsReportException extends ResilienceException {
    public StatisticsReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
