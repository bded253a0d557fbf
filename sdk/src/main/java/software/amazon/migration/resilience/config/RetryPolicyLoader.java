// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.migration.resilience.RetryPolicy;
import software.amazon.migration.resilience.exception.PolicyConfigurationException;
import software.amazon.migration.resilience.retry.ClassificationRules;
import software.amazon.migration.resilience.retry.Durations;
import software.amazon.migration.resilience.retry.RetryCategory;

/**
 * Reads {@link RetryPolicy} settings from JSON documents and environment variables.
 *
 * <p>A policy document may set any subset of the following fields; missing fields keep the default values and unknown
 * fields are ignored.
 *
 * <pre>{@code
 * {
 *   "maxAttempts": 5,
 *   "baseDelaySeconds": 0.5,
 *   "maxDelaySeconds": 30,
 *   "backoffMultiplier": 1.5,
 *   "jitterEnabled": true,
 *   "retryableStatusCodes": [429, 503],
 *   "retryableErrorKinds": ["java.net.ConnectException"],
 *   "messageKeywords": { "throttling": ["slow down"] },
 *   "transientErrorCodes": ["ServiceUnavailable"]
 * }
 * }</pre>
 */
public final class RetryPolicyLoader {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicyLoader.class);

    public static final String ENV_MAX_ATTEMPTS = "MIGRATION_RETRY_MAX_ATTEMPTS";
    public static final String ENV_BASE_DELAY_SECONDS = "MIGRATION_RETRY_BASE_DELAY_SECONDS";
    public static final String ENV_MAX_DELAY_SECONDS = "MIGRATION_RETRY_MAX_DELAY_SECONDS";
    public static final String ENV_BACKOFF_MULTIPLIER = "MIGRATION_RETRY_BACKOFF_MULTIPLIER";
    public static final String ENV_JITTER_ENABLED = "MIGRATION_RETRY_JITTER_ENABLED";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private RetryPolicyLoader() {}

    /**
     * Reads a policy document from a stream. The stream is not closed.
     *
     * @param input JSON policy document
     * @return the policy
     * @throws PolicyConfigurationException if the document cannot be parsed or describes an invalid policy
     */
    public static RetryPolicy fromJson(InputStream input) {
        Objects.requireNonNull(input, "input cannot be null");
        PolicyDocument document;
        try {
            document = OBJECT_MAPPER.readValue(input, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to parse retry policy document", e);
        }
        if (document == null) {
            throw new PolicyConfigurationException("Retry policy document is empty");
        }
        return document.toPolicy();
    }

    /**
     * Reads a policy document from a file.
     *
     * @param path path of the JSON policy document
     * @return the policy
     * @throws PolicyConfigurationException if the file cannot be read or describes an invalid policy
     */
    public static RetryPolicy fromJson(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        try (var input = Files.newInputStream(path)) {
            var policy = fromJson(input);
            logger.debug("Loaded retry policy from {}: {}", path, policy);
            return policy;
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read retry policy from " + path, e);
        }
    }

    /**
     * Applies {@code MIGRATION_RETRY_*} overrides from the process environment to the default policy.
     *
     * @return the policy
     */
    public static RetryPolicy fromEnvironment() {
        return fromEnvironment(RetryPolicy.defaults(), System.getenv());
    }

    /**
     * Applies {@code MIGRATION_RETRY_*} overrides to the default policy.
     *
     * @param environment environment variables
     * @return the policy
     */
    public static RetryPolicy fromEnvironment(Map<String, String> environment) {
        return fromEnvironment(RetryPolicy.defaults(), environment);
    }

    /**
     * Applies {@code MIGRATION_RETRY_*} overrides to a base policy. Blank values are ignored.
     *
     * @param base policy supplying everything that is not overridden
     * @param environment environment variables
     * @return the policy
     * @throws PolicyConfigurationException if a value cannot be parsed or the result is invalid
     */
    public static RetryPolicy fromEnvironment(RetryPolicy base, Map<String, String> environment) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(environment, "environment cannot be null");

        var builder = base.toBuilder();
        var maxAttempts = value(environment, ENV_MAX_ATTEMPTS);
        if (maxAttempts != null) {
            builder.maxAttempts(parseInt(ENV_MAX_ATTEMPTS, maxAttempts));
        }
        var baseDelay = value(environment, ENV_BASE_DELAY_SECONDS);
        if (baseDelay != null) {
            builder.baseDelay(Durations.ofSeconds(parseDouble(ENV_BASE_DELAY_SECONDS, baseDelay)));
        }
        var maxDelay = value(environment, ENV_MAX_DELAY_SECONDS);
        if (maxDelay != null) {
            builder.maxDelay(Durations.ofSeconds(parseDouble(ENV_MAX_DELAY_SECONDS, maxDelay)));
        }
        var multiplier = value(environment, ENV_BACKOFF_MULTIPLIER);
        if (multiplier != null) {
            builder.backoffMultiplier(parseDouble(ENV_BACKOFF_MULTIPLIER, multiplier));
        }
        var jitter = value(environment, ENV_JITTER_ENABLED);
        if (jitter != null) {
            builder.jitterEnabled(parseBoolean(ENV_JITTER_ENABLED, jitter));
        }
        return build(builder);
    }

    private static String value(Map<String, String> environment, String name) {
        var value = environment.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new PolicyConfigurationException(name + " must be an integer, got: " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new PolicyConfigurationException(name + " must be a number, got: " + value, e);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new PolicyConfigurationException(name + " must be true or false, got: " + value);
        }
    }

    private static RetryPolicy build(RetryPolicy.Builder builder) {
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigurationException("Invalid retry policy: " + e.getMessage(), e);
        }
    }

    /** JSON shape of a policy document. Absent fields are null. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class PolicyDocument {
        @JsonProperty("maxAttempts")
        Integer maxAttempts;

        @JsonProperty("baseDelaySeconds")
        Double baseDelaySeconds;

        @JsonProperty("maxDelaySeconds")
        Double maxDelaySeconds;

        @JsonProperty("backoffMultiplier")
        Double backoffMultiplier;

        @JsonProperty("jitterEnabled")
        Boolean jitterEnabled;

        @JsonProperty("retryableStatusCodes")
        Set<Integer> retryableStatusCodes;

        @JsonProperty("retryableErrorKinds")
        List<String> retryableErrorKinds;

        @JsonProperty("messageKeywords")
        Map<String, List<String>> messageKeywords;

        @JsonProperty("transientErrorCodes")
        Set<String> transientErrorCodes;

        RetryPolicy toPolicy() {
            var builder = RetryPolicy.builder();
            if (maxAttempts != null) {
                builder.maxAttempts(maxAttempts);
            }
            if (baseDelaySeconds != null) {
                builder.baseDelay(Durations.ofSeconds(baseDelaySeconds));
            }
            if (maxDelaySeconds != null) {
                builder.maxDelay(Durations.ofSeconds(maxDelaySeconds));
            }
            if (backoffMultiplier != null) {
                builder.backoffMultiplier(backoffMultiplier);
            }
            if (jitterEnabled != null) {
                builder.jitterEnabled(jitterEnabled);
            }
            if (retryableStatusCodes != null) {
                requireNoNullEntries("retryableStatusCodes", retryableStatusCodes);
                builder.retryableStatusCodes(retryableStatusCodes);
            }
            if (retryableErrorKinds != null) {
                builder.retryableErrorKinds(resolveErrorKinds(retryableErrorKinds));
            }
            if (messageKeywords != null || transientErrorCodes != null) {
                builder.classificationRules(toRules());
            }
            return build(builder);
        }

        private ClassificationRules toRules() {
            var rules = ClassificationRules.defaults().toBuilder();
            if (messageKeywords != null) {
                messageKeywords.forEach((name, keywords) -> {
                    if (keywords == null) {
                        throw new PolicyConfigurationException("messageKeywords." + name + " must be a list");
                    }
                    rules.messageKeywords(category(name), keywords);
                });
            }
            if (transientErrorCodes != null) {
                rules.transientErrorCodes(transientErrorCodes);
            }
            return rules.build();
        }

        private static void requireNoNullEntries(String field, Collection<?> values) {
            for (var value : values) {
                if (value == null) {
                    throw new PolicyConfigurationException(field + " must not contain null entries");
                }
            }
        }

        private static RetryCategory category(String name) {
            try {
                return RetryCategory.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new PolicyConfigurationException("Unknown retry category: " + name, e);
            }
        }

        private static Set<Class<? extends Throwable>> resolveErrorKinds(List<String> classNames) {
            requireNoNullEntries("retryableErrorKinds", classNames);
            var kinds = new LinkedHashSet<Class<? extends Throwable>>();
            for (var className : classNames) {
                Class<?> type;
                try {
                    type = Class.forName(className);
                } catch (ClassNotFoundException e) {
                    throw new PolicyConfigurationException("Unknown error kind: " + className, e);
                }
                if (!Throwable.class.isAssignableFrom(type)) {
                    throw new PolicyConfigurationException("Error kind is not a Throwable: " + className);
                }
                kinds.add(type.asSubclass(Throwable.class));
            }
            return kinds;
        }
    }
}
