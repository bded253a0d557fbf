// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.examples;

import java.time.Duration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.SdkSystemSetting;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.mgn.MgnClient;

/** Builds the Application Migration Service client shared by the examples. */
final class MgnClients {
    static final String DEFAULT_REGION = "us-east-1";

    private MgnClients() {}

    /**
     * Creates an MGN client with an Apache HTTP client and the region taken from {@code AWS_REGION}, falling back to
     * us-east-1.
     *
     * <p>The SDK's own retries are turned off so that every retry is made, logged and counted by the resilience layer.
     */
    static MgnClient create() {
        var httpClient = ApacheHttpClient.builder()
                .maxConnections(20)
                .connectionTimeout(Duration.ofSeconds(10))
                .socketTimeout(Duration.ofSeconds(30))
                .build();

        return MgnClient.builder()
                .httpClient(httpClient)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(resolveRegion(System.getenv(SdkSystemSetting.AWS_REGION.environmentVariable()))))
                .overrideConfiguration(config -> config.retryPolicy(RetryPolicy.none()))
                .build();
    }

    static String resolveRegion(String configured) {
        return configured == null || configured.isEmpty() ? DEFAULT_REGION : configured;
    }
}
