package tech.regionguard.failover.replication;

import tech.regionguard.failover.config.FailoverConfig;
import tech.regionguard.failover.model.RegionId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Where CloudWatch publishes the replication lag of one store from a source region
 * to a receiving region.
 *
 * @param queryRegion  region whose CloudWatch holds the metric
 * @param millisPerUnit factor converting the metric's unit to milliseconds
 */
public record LagMetricSource(
    String storeId,
    RegionId sourceRegion,
    RegionId receivingRegion,
    RegionId queryRegion,
    String namespace,
    String metricName,
    Map<String, String> dimensions,
    double millisPerUnit
) {

    /**
     * Metric sources for every ordered pair of regions of a store.
     *
     * @param awsRegions AWS region name per region id
     */
    public static List<LagMetricSource> forStore(String storeId, FailoverConfig.Store store,
                                                 Map<RegionId, String> awsRegions) {
        List<LagMetricSource> sources = new ArrayList<>();
        for (RegionId source : awsRegions.keySet()) {
            for (RegionId receiving : awsRegions.keySet()) {
                if (source.equals(receiving)) {
                    continue;
                }
                LagMetricSource metric = switch (store.type()) {
                    // Emitted in the source region, per receiving region
                    case DYNAMODB -> new LagMetricSource(storeId, source, receiving, source,
                        "AWS/DynamoDB", "ReplicationLatency",
                        Map.of("TableName", store.resource(), "ReceivingRegion", awsRegions.get(receiving)), 1.0);
                    // Emitted by the secondary cluster in the receiving region
                    case AURORA -> {
                        String receivingCluster = store.regionalResources().get(receiving.value());
                        yield receivingCluster == null ? null : new LagMetricSource(storeId, source, receiving, receiving,
                            "AWS/RDS", "AuroraGlobalDBReplicationLag",
                            Map.of("DBClusterIdentifier", clusterIdentifier(receivingCluster)), 1.0);
                    }
                    // Reported in seconds, in the source bucket's region
                    case S3 -> {
                        String destination = store.regionalResources().get(receiving.value());
                        String sourceBucket = store.regionalResources().getOrDefault(source.value(), store.resource());
                        yield destination == null || store.replicationRuleId().isEmpty() ? null
                            : new LagMetricSource(storeId, source, receiving, source,
                                "AWS/S3", "ReplicationLatency",
                                Map.of("SourceBucket", sourceBucket, "DestinationBucket", destination,
                                    "RuleId", store.replicationRuleId().get()), 1000.0);
                    }
                    case NONE -> null;
                };
                if (metric != null) {
                    sources.add(metric);
                }
            }
        }
        return sources;
    }

    private static String clusterIdentifier(String clusterArnOrId) {
        int idx = clusterArnOrId.lastIndexOf(":cluster:");
        return idx >= 0 ? clusterArnOrId.substring(idx + ":cluster:".length()) : clusterArnOrId;
    }
}
