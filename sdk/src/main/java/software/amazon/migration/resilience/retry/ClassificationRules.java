// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.retry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword and error-code tables used by {@link ErrorClassifier} when a failure carries no decisive status code.
 *
 * <p>The wording of error messages depends entirely on the remote system and its client library, so the tables are
 * data rather than code. Message keywords are matched case-insensitively as substrings, category by category in
 * insertion order. Error codes are compared after {@link #normalizeErrorCode(String) normalization}.
 */
public final class ClassificationRules {

    private static final ClassificationRules DEFAULTS = builder()
            .messageKeywords(RetryCategory.TIMEOUT, List.of("timeout", "timed out"))
            .messageKeywords(RetryCategory.THROTTLING, List.of("throttl", "rate limit"))
            .messageKeywords(RetryCategory.NETWORK_ERROR, List.of("connection", "network"))
            .messageKeywords(
                    RetryCategory.SERVICE_UNAVAILABLE, List.of("service unavailable", "temporary", "transient"))
            .transientErrorCodes(Set.of(
                    "InternalServerError",
                    "ServiceUnavailable",
                    "TemporaryRedirect",
                    "TooManyRequest",
                    "TooManyRequests",
                    "RequestTimeout",
                    "InternalFailure",
                    "Throttling",
                    "ThrottlingException",
                    "RequestLimitExceeded",
                    "SlowDown"))
            .build();

    private final Map<RetryCategory, List<String>> messageKeywords;
    private final Set<String> transientErrorCodes;

    private ClassificationRules(Builder builder) {
        var keywords = new LinkedHashMap<RetryCategory, List<String>>();
        builder.messageKeywords.forEach((category, words) -> keywords.put(category, List.copyOf(words)));
        this.messageKeywords = Collections.unmodifiableMap(keywords);
        this.transientErrorCodes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.transientErrorCodes));
    }

    /** @return the rules matching the wording of common cloud management SDK errors */
    public static ClassificationRules defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return a builder pre-populated with these rules */
    public Builder toBuilder() {
        var builder = new Builder();
        messageKeywords.forEach(builder::messageKeywords);
        builder.transientErrorCodes(transientErrorCodes);
        return builder;
    }

    /** @return keywords per category, in matching order */
    public Map<RetryCategory, List<String>> messageKeywords() {
        return messageKeywords;
    }

    /** @return normalized transient provider error codes */
    public Set<String> transientErrorCodes() {
        return transientErrorCodes;
    }

    /**
     * Finds the first category whose keywords occur in the message.
     *
     * @param message failure description, may be null
     * @return the matching category, or empty if no keyword matches
     */
    public Optional<RetryCategory> matchMessage(String message) {
        if (message == null || message.isEmpty()) {
            return Optional.empty();
        }
        var haystack = message.toLowerCase(Locale.ROOT);
        for (var entry : messageKeywords.entrySet()) {
            for (var keyword : entry.getValue()) {
                if (haystack.contains(keyword)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @param errorCode provider error code, may be null
     * @return true if the code denotes a transient condition
     */
    public boolean isTransientErrorCode(String errorCode) {
        return errorCode != null && transientErrorCodes.contains(normalizeErrorCode(errorCode));
    }

    /**
     * Lower-cases the code and strips everything that is not a letter or digit, so that {@code TooManyRequests},
     * {@code too_many_requests} and {@code too-many-requests} compare equal.
     */
    public static String normalizeErrorCode(String errorCode) {
        return errorCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /** Builder for ClassificationRules. */
    public static final class Builder {
        private final Map<RetryCategory, List<String>> messageKeywords = new LinkedHashMap<>();
        private final Set<String> transientErrorCodes = new LinkedHashSet<>();

        private Builder() {}

        /**
         * Sets the keywords for a category, replacing any previous ones. A category added for the first time is
         * matched after the categories already present.
         *
         * @param category the category the keywords indicate
         * @param keywords substrings to look for; matched case-insensitively
         * @return this builder
         */
        public Builder messageKeywords(RetryCategory category, List<String> keywords) {
            Objects.requireNonNull(category, "category cannot be null");
            Objects.requireNonNull(keywords, "keywords cannot be null");
            messageKeywords.put(
                    category,
                    keywords.stream()
                            .filter(Objects::nonNull)
                            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                            .filter(keyword -> !keyword.isBlank())
                            .toList());
            return this;
        }

        /**
         * Replaces the transient provider error codes.
         *
         * @param errorCodes codes in any casing or separator style
         * @return this builder
         */
        public Builder transientErrorCodes(Set<String> errorCodes) {
            Objects.requireNonNull(errorCodes, "errorCodes cannot be null");
            transientErrorCodes.clear();
            errorCodes.stream()
                    .filter(Objects::nonNull)
                    .map(ClassificationRules::normalizeErrorCode)
                    .filter(code -> !code.isEmpty())
                    .forEach(transientErrorCodes::add);
            return this;
        }

        public ClassificationRules build() {
            return new ClassificationRules(this);
        }
    }
}
