// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience;

import java.util.Objects;

/**
 * A {@link RemoteOperation} with retry behavior attached.
 *
 * <pre>{@code
 * RemoteOperation<DescribeSourceServersResponse> describe =
 *     RetryingOperation.wrap(() -> mgnClient.describeSourceServers(request), RetryPolicies.Presets.CLOUD_API);
 *
 * describe.call(); // retried on throttling, timeouts, 5xx...
 * }</pre>
 *
 * @param <T> the result type
 */
public final class RetryingOperation<T> implements RemoteOperation<T> {
    private final RemoteOperation<T> delegate;
    private final RetryExecutor executor;

    RetryingOperation(RemoteOperation<T> delegate, RetryExecutor executor) {
        this.delegate = Objects.requireNonNull(delegate, "operation cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    /**
     * Wraps an operation using the default policy.
     *
     * @param operation the operation to wrap
     * @param <T> the result type
     * @return the retrying operation
     */
    public static <T> RetryingOperation<T> wrap(RemoteOperation<T> operation) {
        return wrap(operation, RetryPolicy.defaults());
    }

    /**
     * Wraps an operation using the given policy and the shared statistics.
     *
     * @param operation the operation to wrap
     * @param policy the retry policy
     * @param <T> the result type
     * @return the retrying operation
     */
    public static <T> RetryingOperation<T> wrap(RemoteOperation<T> operation, RetryPolicy policy) {
        return new RetryingOperation<>(operation, RetryExecutor.create(policy));
    }

    /**
     * Runs the wrapped operation through the executor. Failures propagate exactly as the wrapped operation raised
     * them.
     */
    @Override
    public T call() {
        return executor.execute(delegate);
    }

    public RetryExecutor getExecutor() {
        return executor;
    }
}
