// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.exception;

/** Exception thrown when a retry policy document or environment override cannot be applied. */
public class PolicyConfigurationException extends ResilienceException {
    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
