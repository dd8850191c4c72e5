package tech.regionguard.failover.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for region monitoring and failover orchestration.
 *
 * Regions and stores are keyed by their identifiers, e.g.
 * {@code failover.regions.PRIMARY.aws-region=us-east-1} or
 * {@code failover.stores.transactions.type=DYNAMODB}.
 */
@ConfigMapping(prefix = "failover")
public interface FailoverConfig {

    /**
     * Region id of the region that is active on first start.
     */
    @WithDefault("PRIMARY")
    String primaryRegion();

    /**
     * Region id of the failover target.
     */
    @WithDefault("SECONDARY")
    String secondaryRegion();

    /**
     * Per-region settings keyed by region id.
     */
    Map<String, RegionSettings> regions();

    Probe probe();

    Hysteresis hysteresis();

    Replication replication();

    /**
     * Replicated data stores keyed by store id.
     */
    Map<String, Store> stores();

    Decision decision();

    Cutover cutover();

    Routing routing();

    WriteFence writeFence();

    Workflow workflow();

    Alerting alerting();

    State state();

    Aws aws();

    interface RegionSettings {
        /**
         * AWS region name, e.g. us-east-1.
         */
        String awsRegion();

        /**
         * Health endpoints probed over HTTP. Each endpoint is an independent probe.
         */
        Optional<List<String>> healthEndpoints();

        /**
         * Route 53 health check id for this region's failover record.
         */
        Optional<String> healthCheckId();

        /**
         * Value of this region's failover record (e.g. the regional API domain).
         */
        Optional<String> routingTarget();
    }

    interface Probe {
        @WithDefault("10s")
        Duration interval();

        @WithDefault("2s")
        Duration timeout();

        /**
         * A health endpoint answering slower than this counts as failed.
         */
        @WithDefault("500")
        long latencyThresholdMillis();

        /**
         * Use the routing layer's health checks as an extra probe per region.
         */
        @WithDefault("false")
        boolean routingHealthCheckEnabled();

        @WithDefault("4")
        int threads();
    }

    interface Hysteresis {
        /**
         * K: consecutive failing rounds before HEALTHY becomes DEGRADED.
         */
        @WithDefault("3")
        int failureRounds();

        /**
         * K2: further consecutive failing rounds before DEGRADED becomes UNHEALTHY.
         */
        @WithDefault("3")
        int unhealthyRounds();

        /**
         * Kd: consecutive successful rounds before DEGRADED returns to HEALTHY.
         */
        @WithDefault("5")
        int degradedRecoveryRounds();

        /**
         * R: consecutive successful rounds before UNHEALTHY returns to HEALTHY. Must exceed K + K2.
         */
        @WithDefault("10")
        int recoveryRounds();

        /**
         * W: trailing window a round may stay open before missing probes count as failed.
         */
        @WithDefault("180s")
        Duration window();
    }

    interface Replication {
        /**
         * How often each store is expected to report lag. Silence for twice this long is stale.
         */
        @WithDefault("30s")
        Duration expectedInterval();

        @WithDefault("false")
        boolean cloudwatchEnabled();

        /**
         * How often CloudWatch replication metrics are read when enabled. Must not exceed the
         * expected interval.
         */
        @WithDefault("30s")
        Duration pollInterval();
    }

    interface Store {
        StoreType type();

        /**
         * Table name, global cluster identifier or source bucket.
         */
        String resource();

        /**
         * Per-region resource names keyed by region id: Aurora member cluster ARNs
         * or S3 destination buckets.
         */
        Map<String, String> regionalResources();

        /**
         * S3 replication rule id used as a CloudWatch dimension.
         */
        Optional<String> replicationRuleId();
    }

    enum StoreType {
        DYNAMODB,
        AURORA,
        S3,
        NONE
    }

    interface Decision {
        @WithDefault("5s")
        String interval();

        @WithDefault("5000")
        long rpoBoundMillis();

        @WithDefault("15m")
        Duration rtoDeadline();

        /**
         * Execute fail-back without operator confirmation.
         */
        @WithDefault("false")
        boolean autoFailback();
    }

    interface Cutover {
        @WithDefault("2m")
        Duration stepTimeout();

        @WithDefault("1000")
        long drainThresholdMillis();

        @WithDefault("60s")
        Duration drainTimeout();

        @WithDefault("2s")
        Duration drainPollInterval();

        /**
         * Lag that may be abandoned when replication does not drain in time.
         */
        @WithDefault("5000")
        long acceptedDataLossMillis();

        /**
         * How long terminal plan executions are kept for audit.
         */
        @WithDefault("7d")
        Duration retention();
    }

    interface Routing {
        @WithDefault("NOOP")
        RoutingType type();

        Optional<String> hostedZoneId();

        /**
         * DNS name of the failover record pair.
         */
        Optional<String> recordName();

        @WithDefault("60")
        long recordTtlSeconds();
    }

    enum RoutingType {
        NOOP,
        ROUTE53
    }

    interface WriteFence {
        @WithDefault("NOOP")
        FenceType type();

        @WithDefault("/regionguard/write-fence/")
        String parameterPrefix();
    }

    enum FenceType {
        NOOP,
        SSM
    }

    interface Workflow {
        @WithDefault("3")
        int maxResumeAttempts();

        @WithDefault("7d")
        Duration retention();
    }

    interface Alerting {
        @WithDefault("false")
        boolean snsEnabled();

        Optional<String> snsTopicArn();

        /**
         * AWS region of the SNS topic.
         */
        Optional<String> snsRegion();
    }

    interface State {
        @WithDefault("MEMORY")
        StateStoreType type();

        @WithDefault("./regionguard-state")
        String directory();
    }

    enum StateStoreType {
        MEMORY,
        FILE
    }

    interface Aws {
        /**
         * Endpoint override for all AWS clients (LocalStack).
         */
        Optional<String> endpointOverride();
    }
}
