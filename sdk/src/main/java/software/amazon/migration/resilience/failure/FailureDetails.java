// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.failure;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fields extracted from a failure by {@link FailureInspector}.
 *
 * @param statusCode transport status code, empty when the failure carries none
 * @param errorCode provider error code, empty when the failure carries none
 * @param retryAfter raw retry-after hint, empty when the server supplied none
 * @param message the failure's own message, empty when it has none
 */
public record FailureDetails(
        OptionalInt statusCode, Optional<String> errorCode, Optional<String> retryAfter, String message) {}
