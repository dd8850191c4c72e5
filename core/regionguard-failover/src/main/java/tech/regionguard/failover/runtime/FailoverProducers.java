package tech.regionguard.failover.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.regionguard.failover.alert.AlertDispatcher;
import tech.regionguard.failover.alert.AlertSink;
import tech.regionguard.failover.alert.SnsAlertSink;
import tech.regionguard.failover.alert.WarningAlertSink;
import tech.regionguard.failover.aws.AwsClientFactory;
import tech.regionguard.failover.config.CutoverSettings;
import tech.regionguard.failover.config.DecisionPolicy;
import tech.regionguard.failover.config.FailoverConfig;
import tech.regionguard.failover.config.HysteresisPolicy;
import tech.regionguard.failover.cutover.CutoverCoordinator;
import tech.regionguard.failover.cutover.LeadershipCheck;
import tech.regionguard.failover.decision.FailoverDecisionEngine;
import tech.regionguard.failover.fence.InMemoryWriteFence;
import tech.regionguard.failover.fence.SsmParameterWriteFence;
import tech.regionguard.failover.fence.WriteFence;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.probe.HttpHealthEndpointProbe;
import tech.regionguard.failover.probe.ProbeScheduler;
import tech.regionguard.failover.probe.RegionProbe;
import tech.regionguard.failover.probe.RoutingHealthCheckProbe;
import tech.regionguard.failover.replication.AuroraGlobalClusterStore;
import tech.regionguard.failover.replication.CloudWatchReplicationLagPoller;
import tech.regionguard.failover.replication.DynamoDbGlobalTableStore;
import tech.regionguard.failover.replication.LagMetricSource;
import tech.regionguard.failover.replication.NoOpReplicatedStore;
import tech.regionguard.failover.replication.ReplicatedStore;
import tech.regionguard.failover.replication.ReplicationLagTracker;
import tech.regionguard.failover.routing.InMemoryRoutingStrategy;
import tech.regionguard.failover.routing.Route53FailoverRoutingStrategy;
import tech.regionguard.failover.routing.TrafficRoutingStrategy;
import tech.regionguard.failover.state.FailoverStateStore;
import tech.regionguard.failover.warning.WarningService;
import tech.regionguard.failover.workflow.NoOpWorkflowEngine;
import tech.regionguard.failover.workflow.WorkflowConsistencyGuard;
import tech.regionguard.failover.workflow.WorkflowEngine;
import tech.regionguard.lease.LeadershipService;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Wires the failover components from configuration. Backends for routing, fencing,
 * storage and alerting are picked by their {@code type} settings.
 */
@ApplicationScoped
public class FailoverProducers {

    private static final Logger LOG = Logger.getLogger(FailoverProducers.class);
    private static final Duration AWS_POLL_INTERVAL = Duration.ofSeconds(5);

    @Inject
    FailoverConfig config;

    @Inject
    AwsClientFactory awsClients;

    private final ExecutorService alertExecutor = daemonPool("failover-alert", 2);
    private final ExecutorService stepExecutor = daemonPool("cutover-step", 2);
    private final ExecutorService planExecutor = daemonPool("cutover-plan", 1);

    private List<RegionProbe> probes;

    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public HysteresisPolicy hysteresisPolicy() {
        return HysteresisPolicy.from(config.hysteresis());
    }

    @Produces
    @Singleton
    public DecisionPolicy decisionPolicy() {
        return DecisionPolicy.from(config.decision());
    }

    @Produces
    @Singleton
    public CutoverSettings cutoverSettings() {
        return CutoverSettings.from(config.cutover());
    }

    @Produces
    @Singleton
    public ReplicationLagTracker replicationLagTracker(Clock clock) {
        ReplicationLagTracker tracker = new ReplicationLagTracker(clock, config.replication().expectedInterval());
        config.stores().forEach((storeId, store) -> {
            if (store.type() == FailoverConfig.StoreType.NONE) {
                return;
            }
            // Lag is tracked into every region, so both failover and fail-back are gated
            for (String regionId : config.regions().keySet()) {
                tracker.register(storeId, RegionId.of(regionId));
            }
        });
        return tracker;
    }

    @Produces
    @Singleton
    public TrafficRoutingStrategy trafficRoutingStrategy() {
        FailoverConfig.RoutingType type = config.routing().type();
        LOG.infof("Initializing traffic routing strategy: %s", type);

        return switch (type) {
            case NOOP -> new InMemoryRoutingStrategy(primaryRegion());
            case ROUTE53 -> {
                String zone = config.routing().hostedZoneId()
                    .orElseThrow(() -> new IllegalStateException("failover.routing.hosted-zone-id is required for ROUTE53"));
                String recordName = config.routing().recordName()
                    .orElseThrow(() -> new IllegalStateException("failover.routing.record-name is required for ROUTE53"));
                Map<RegionId, Route53FailoverRoutingStrategy.RegionRecord> records = new LinkedHashMap<>();
                config.regions().forEach((id, settings) -> records.put(RegionId.of(id),
                    new Route53FailoverRoutingStrategy.RegionRecord(
                        settings.routingTarget().orElseThrow(() -> new IllegalStateException(
                            "failover.regions." + id + ".routing-target is required for ROUTE53")),
                        settings.healthCheckId().orElse(null))));
                yield new Route53FailoverRoutingStrategy(awsClients.route53(), zone, recordName,
                    config.routing().recordTtlSeconds(), records, AWS_POLL_INTERVAL);
            }
        };
    }

    @Produces
    @Singleton
    public WriteFence writeFence() {
        FailoverConfig.FenceType type = config.writeFence().type();
        LOG.infof("Initializing write fence: %s", type);

        return switch (type) {
            case NOOP -> new InMemoryWriteFence();
            case SSM -> new SsmParameterWriteFence(awsClients.ssm(), config.writeFence().parameterPrefix());
        };
    }

    @Produces
    @Singleton
    public AlertSink alertSink(WarningService warningService) {
        List<AlertSink> sinks = new ArrayList<>();
        sinks.add(new WarningAlertSink(warningService));

        FailoverConfig.Alerting alerting = config.alerting();
        if (alerting.snsEnabled()) {
            String topicArn = alerting.snsTopicArn()
                .orElseThrow(() -> new IllegalStateException("failover.alerting.sns-topic-arn is required when SNS is enabled"));
            String region = alerting.snsRegion()
                .orElseGet(() -> config.regions().get(config.primaryRegion()).awsRegion());
            sinks.add(new SnsAlertSink(awsClients.sns(region), topicArn));
            LOG.infof("SNS alerting enabled: %s", topicArn);
        }
        return new AlertDispatcher(sinks, alertExecutor);
    }

    @Produces
    @Singleton
    @DefaultBean
    public WorkflowEngine workflowEngine() {
        LOG.info("No workflow engine integrated, using no-op engine");
        return new NoOpWorkflowEngine();
    }

    @Produces
    @Singleton
    public WorkflowConsistencyGuard workflowConsistencyGuard(WorkflowEngine engine, FailoverStateStore stateStore,
                                                             AlertSink alertSink, Clock clock) {
        return new WorkflowConsistencyGuard(engine, stateStore, alertSink, config.workflow().maxResumeAttempts(), clock);
    }

    @Produces
    @Singleton
    public HealthAggregator healthAggregator(HysteresisPolicy policy, TrafficRoutingStrategy routing, Clock clock) {
        return new HealthAggregator(ProbeScheduler.probeIdsByRegion(probes(routing, clock)), policy, primaryRegion(), clock);
    }

    @Produces
    @Singleton
    public ProbeScheduler probeScheduler(HealthAggregator aggregator, TrafficRoutingStrategy routing, Clock clock) {
        return new ProbeScheduler(probes(routing, clock), aggregator::submit, config.probe().interval(),
            config.probe().threads(), clock);
    }

    @Produces
    @Singleton
    public LeadershipCheck leadershipCheck(LeadershipService leadership) {
        return new LeadershipCheck() {
            @Override
            public OptionalLong currentEpoch() {
                return leadership.currentEpoch();
            }

            @Override
            public boolean confirm(long epoch) {
                return leadership.confirm(epoch);
            }
        };
    }

    @Produces
    @Singleton
    public CutoverCoordinator cutoverCoordinator(WriteFence writeFence, ReplicationLagTracker lagTracker,
                                                 TrafficRoutingStrategy routing, LeadershipCheck leadership,
                                                 WorkflowConsistencyGuard guard, FailoverStateStore stateStore,
                                                 AlertSink alertSink, CutoverSettings settings, Clock clock) {
        return new CutoverCoordinator(writeFence, lagTracker, replicatedStores(), routing, leadership, guard,
            stateStore, alertSink, settings, clock, stepExecutor);
    }

    @Produces
    @Singleton
    public FailoverDecisionEngine failoverDecisionEngine(HealthAggregator aggregator, ReplicationLagTracker lagTracker,
                                                         CutoverCoordinator coordinator, WorkflowConsistencyGuard guard,
                                                         FailoverStateStore stateStore, AlertSink alertSink,
                                                         DecisionPolicy policy, LeadershipService leadership,
                                                         Clock clock) {
        return new FailoverDecisionEngine(aggregator, lagTracker, coordinator, guard, stateStore, alertSink, policy,
            primaryRegion(), secondaryRegion(), leadership::isLeader, planExecutor, clock);
    }

    @Produces
    @Singleton
    public CloudWatchReplicationLagPoller cloudWatchReplicationLagPoller(ReplicationLagTracker tracker,
                                                                         HealthAggregator aggregator, Clock clock) {
        Map<RegionId, String> awsRegions = awsClients.awsRegions();
        List<LagMetricSource> sources = new ArrayList<>();
        config.stores().forEach((storeId, store) -> sources.addAll(LagMetricSource.forStore(storeId, store, awsRegions)));
        LOG.infof("CloudWatch replication lag polling for %d metric source(s)", sources.size());
        return new CloudWatchReplicationLagPoller(awsClients.cloudWatch(), sources, tracker, aggregator::activeRegion, clock);
    }

    @PreDestroy
    void shutdown() {
        planExecutor.shutdownNow();
        stepExecutor.shutdownNow();
        alertExecutor.shutdown();
        try {
            if (!alertExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                alertExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            alertExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    RegionId primaryRegion() {
        return RegionId.of(config.primaryRegion());
    }

    RegionId secondaryRegion() {
        return RegionId.of(config.secondaryRegion());
    }

    private synchronized List<RegionProbe> probes(TrafficRoutingStrategy routing, Clock clock) {
        if (probes != null) {
            return probes;
        }
        List<RegionProbe> result = new ArrayList<>();
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.probe().timeout())
            .build();
        ObjectMapper objectMapper = new ObjectMapper();

        // Endpoint i of every region forms probe http-i
        int maxEndpoints = config.regions().values().stream()
            .mapToInt(r -> r.healthEndpoints().map(List::size).orElse(0))
            .max()
            .orElse(0);
        for (int i = 0; i < maxEndpoints; i++) {
            Map<RegionId, URI> endpoints = new LinkedHashMap<>();
            for (Map.Entry<String, FailoverConfig.RegionSettings> region : config.regions().entrySet()) {
                List<String> urls = region.getValue().healthEndpoints().orElse(List.of());
                if (i < urls.size()) {
                    endpoints.put(RegionId.of(region.getKey()), URI.create(urls.get(i)));
                }
            }
            result.add(new HttpHealthEndpointProbe("http-" + i, endpoints, httpClient, objectMapper,
                config.probe().timeout(), config.probe().latencyThresholdMillis(), clock));
        }

        if (config.probe().routingHealthCheckEnabled()) {
            result.add(new RoutingHealthCheckProbe(routing,
                config.regions().keySet().stream().map(RegionId::of).collect(Collectors.toSet()), clock));
        }

        if (result.isEmpty()) {
            LOG.warn("No region probes configured - verdicts will only change through round timeouts");
        }
        probes = List.copyOf(result);
        return probes;
    }

    private List<ReplicatedStore> replicatedStores() {
        Map<RegionId, String> awsRegions = awsClients.awsRegions();
        List<ReplicatedStore> stores = new ArrayList<>();
        config.stores().forEach((storeId, store) -> {
            ReplicatedStore replicated = switch (store.type()) {
                case DYNAMODB -> new DynamoDbGlobalTableStore(storeId, store.resource(), awsRegions, awsClients.dynamoDb());
                case AURORA -> {
                    Map<RegionId, String> members = new LinkedHashMap<>();
                    store.regionalResources().forEach((region, arn) -> members.put(RegionId.of(region), arn));
                    yield new AuroraGlobalClusterStore(storeId, store.resource(), members, awsClients.rds(), AWS_POLL_INTERVAL);
                }
                // S3 replication is active-active, nothing to promote
                case S3, NONE -> new NoOpReplicatedStore(storeId);
            };
            LOG.infof("Replicated store %s: %s (%s)", storeId, store.type(), store.resource());
            stores.add(replicated);
        });
        return stores;
    }

    private static ExecutorService daemonPool(String name, int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
