// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience;

/**
 * A unit of remote work that either produces a value or fails.
 *
 * <p>Typically a single call through a cloud SDK client, e.g. {@code () -> mgnClient.describeSourceServers(request)}.
 * An operation may be invoked more than once, so it should be safe to repeat.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface RemoteOperation<T> {

    /**
     * Performs the operation.
     *
     * @return the result
     * @throws Exception if the operation fails
     */
    T call() throws Exception;
}
