// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

/**
 * Reason a failed remote call is considered transient.
 *
 * <p>The category drives the notice logged before each retry and scales the computed backoff delay. Failures that
 * fit none of these categories are not retried.
 */
public enum RetryCategory {

    /** The remote API rejected the call because of rate limiting. Waits twice as long as the base backoff. */
    THROTTLING("API rate limit exceeded", 2.0),

    /** Connectivity to the remote endpoint failed. Waits one and a half times the base backoff. */
    NETWORK_ERROR("Network connectivity issue", 1.5),

    /** The service reported itself overloaded or temporarily down. */
    SERVICE_UNAVAILABLE("Cloud service temporarily unavailable", 1.0),

    /** The call or the connection timed out. */
    TIMEOUT("Request timed out", 1.0),

    /** A transient condition without a more specific category. */
    TRANSIENT_OTHER("Transient error detected", 1.0);

    private final String notice;
    private final double delayFactor;

    RetryCategory(String notice, double delayFactor) {
        this.notice = notice;
        this.delayFactor = delayFactor;
    }

    /** @return short human-readable description used in retry notices */
    public String notice() {
        return notice;
    }

    /** @return factor applied to the exponential backoff delay for this category */
    public double delayFactor() {
        return delayFactor;
    }
}
