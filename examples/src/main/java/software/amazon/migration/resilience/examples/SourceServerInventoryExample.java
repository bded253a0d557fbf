// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.examples;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.mgn.MgnClient;
import software.amazon.awssdk.services.mgn.model.DescribeSourceServersRequest;
import software.amazon.awssdk.services.mgn.model.DescribeSourceServersResponse;
import software.amazon.awssdk.services.mgn.model.SourceServer;
import software.amazon.migration.resilience.RetryExecutor;
import software.amazon.migration.resilience.RetryPolicies;
import software.amazon.migration.resilience.RetryingOperation;
import software.amazon.migration.resilience.stats.StatisticsReporter;

/**
 * Example listing every source server registered with AWS Application Migration Service.
 *
 * <p>Each page request is a wrapped operation using the {@link RetryPolicies.Presets#CLOUD_API} policy, so throttling
 * and transient service errors on any page are retried without restarting the listing.
 */
public class SourceServerInventoryExample {
    private static final Logger logger = LoggerFactory.getLogger(SourceServerInventoryExample.class);

    static final int PAGE_SIZE = 50;

    private final MgnClient mgnClient;
    private final RetryExecutor executor;

    public SourceServerInventoryExample(MgnClient mgnClient) {
        this(
                mgnClient,
                RetryExecutor.builder()
                        .policy(RetryPolicies.Presets.CLOUD_API)
                        .operationName("describe-source-servers")
                        .build());
    }

    public SourceServerInventoryExample(MgnClient mgnClient, RetryExecutor executor) {
        this.mgnClient = mgnClient;
        this.executor = executor;
    }

    /**
     * Lists all source servers, following pagination tokens until the last page.
     *
     * @return the source servers in the order returned by the service
     */
    public List<SourceServer> listSourceServers() {
        var servers = new ArrayList<SourceServer>();
        String nextToken = null;
        do {
            var request = DescribeSourceServersRequest.builder()
                    .maxResults(PAGE_SIZE)
                    .nextToken(nextToken)
                    .build();
            RetryingOperation<DescribeSourceServersResponse> describePage =
                    executor.decorate(() -> mgnClient.describeSourceServers(request));

            var response = describePage.call();
            servers.addAll(response.items());
            nextToken = response.nextToken();
            logger.debug("Fetched {} source servers, more pages: {}", response.items().size(), nextToken != null);
        } while (nextToken != null && !nextToken.isEmpty());
        return servers;
    }

    public RetryExecutor getExecutor() {
        return executor;
    }

    public static void main(String[] args) {
        try (var mgnClient = MgnClients.create()) {
            var example = new SourceServerInventoryExample(mgnClient);

            var servers = example.listSourceServers();
            logger.info("Found {} source servers", servers.size());
            for (var server : servers) {
                logger.info("  {}", server.sourceServerID());
            }

            new StatisticsReporter().logSummary(example.getExecutor().getStatistics().snapshot());
        }
    }
}
