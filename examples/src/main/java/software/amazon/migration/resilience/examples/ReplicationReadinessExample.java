// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.migration.resilience.examples;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.mgn.MgnClient;
import software.amazon.awssdk.services.mgn.model.DataReplicationState;
import software.amazon.awssdk.services.mgn.model.DescribeSourceServersRequest;
import software.amazon.awssdk.services.mgn.model.DescribeSourceServersRequestFilters;
import software.amazon.awssdk.services.mgn.model.SourceServer;
import software.amazon.migration.resilience.RetryExecutor;
import software.amazon.migration.resilience.RetryPolicies;
import software.amazon.migration.resilience.stats.StatisticsReporter;

/**
 * Example checking whether a source server is ready for cutover.
 *
 * <p>The check is a one-off call made through a {@link RetryExecutor} whose policy is overridden with
 * {@link RetryPolicies.Presets#CRITICAL_OPERATION} for that call only. The statistics collected by the executor are
 * logged afterwards.
 */
public class ReplicationReadinessExample {
    private static final Logger logger = LoggerFactory.getLogger(ReplicationReadinessExample.class);

    private final MgnClient mgnClient;
    private final RetryExecutor executor;
    private final StatisticsReporter reporter;

    public ReplicationReadinessExample(MgnClient mgnClient) {
        this(mgnClient, RetryExecutor.create(), new StatisticsReporter());
    }

    public ReplicationReadinessExample(MgnClient mgnClient, RetryExecutor executor, StatisticsReporter reporter) {
        this.mgnClient = mgnClient;
        this.executor = executor;
        this.reporter = reporter;
    }

    /**
     * @param sourceServerId the MGN source server id, e.g. {@code s-1234567890abcdef0}
     * @return true if the server is found and its data replication is continuous
     */
    public boolean isReadyForCutover(String sourceServerId) {
        var critical = executor.withPolicy(RetryPolicies.Presets.CRITICAL_OPERATION)
                .withOperationName("check-replication-" + sourceServerId);
        var request = DescribeSourceServersRequest.builder()
                .filters(DescribeSourceServersRequestFilters.builder()
                        .sourceServerIDs(sourceServerId)
                        .build())
                .build();

        try {
            var response = critical.execute(() -> mgnClient.describeSourceServers(request));
            var ready = response.items().stream()
                    .findFirst()
                    .map(ReplicationReadinessExample::isReplicating)
                    .orElse(false);
            logger.info("Source server {} ready for cutover: {}", sourceServerId, ready);
            return ready;
        } finally {
            reporter.logSummary(executor.getStatistics().snapshot());
        }
    }

    private static boolean isReplicating(SourceServer server) {
        return server.dataReplicationInfo() != null
                && server.dataReplicationInfo().dataReplicationState() == DataReplicationState.CONTINUOUS;
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            logger.error("Usage: ReplicationReadinessExample <source-server-id>");
            return;
        }
        try (var mgnClient = MgnClients.create()) {
            new ReplicationReadinessExample(mgnClient).isReadyForCutover(args[0]);
        }
    }
}
