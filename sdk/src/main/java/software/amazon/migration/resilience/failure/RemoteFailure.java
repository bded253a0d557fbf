// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.failure;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Structured view of a failed remote call.
 *
 * <p>Exceptions raised by non-AWS clients can implement this interface to take part in status-code, error-code and
 * retry-after handling. AWS SDK v2 service exceptions are understood without it, see {@link FailureInspector}.
 */
public interface RemoteFailure {

    /** @return the transport or protocol status code, if the failure carries one */
    default OptionalInt statusCode() {
        return OptionalInt.empty();
    }

    /** @return the provider-specific error code (for example {@code ServiceUnavailable}), if any */
    default Optional<String> errorCode() {
        return Optional.empty();
    }

    /** @return the raw server-supplied retry-after value, if any */
    default Optional<String> retryAfter() {
        return Optional.empty();
    }
}
