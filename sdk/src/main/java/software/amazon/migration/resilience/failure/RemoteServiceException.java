// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.failure;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Unchecked exception carrying the structured fields of a failed remote call.
 *
 * <p>Useful for adapting clients whose own exceptions do not expose a status code, an error code or a retry-after
 * hint in a form the SDK understands.
 *
 * <pre>{@code
 * throw RemoteServiceException.builder("Too many requests")
 *         .statusCode(429)
 *         .errorCode("TooManyRequests")
 *         .retryAfter("3")
 *         .build();
 * }</pre>
 */
public class RemoteServiceException extends RuntimeException implements RemoteFailure {
    private final Integer statusCode;
    private final String errorCode;
    private final String retryAfter;

    private RemoteServiceException(Builder builder) {
        super(builder.message, builder.cause);
        this.statusCode = builder.statusCode;
        this.errorCode = builder.errorCode;
        this.retryAfter = builder.retryAfter;
    }

    public static Builder builder(String message) {
        return new Builder(message);
    }

    @Override
    public OptionalInt statusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    @Override
    public Optional<String> errorCode() {
        return Optional.ofNullable(errorCode);
    }

    @Override
    public Optional<String> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /** Builder for RemoteServiceException. */
    public static final class Builder {
        private final String message;
        private Integer statusCode;
        private String errorCode;
        private String retryAfter;
        private Throwable cause;

        private Builder(String message) {
            this.message = message;
        }

        public Builder statusCode(Integer statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder retryAfter(String retryAfter) {
            this.retryAfter = retryAfter;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public RemoteServiceException build() {
            return new RemoteServiceException(this);
        }
    }
}
