// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.exception;

/** Base class for exceptions raised by the SDK itself, as opposed to failures of the wrapped operations. */
public class ResilienceException extends RuntimeException {
    public ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }

    public ResilienceException(String message) {
        super(message);
    }
}
