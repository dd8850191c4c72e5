package tech.regionguard.failover.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.regionguard.failover.decision.FailoverDecisionEngine;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;
import tech.regionguard.failover.model.VerdictTransition;
import tech.regionguard.failover.replication.ReplicationLagTracker;

/**
 * Micrometer gauges for the operating mode, region verdicts and replication lag.
 *
 * <p>Mode and verdict gauges report the enum ordinal. Lag toward each region reports -1 while stale.</p>
 */
@ApplicationScoped
public class FailoverMetrics {

    private static final Logger LOG = Logger.getLogger(FailoverMetrics.class);

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    FailoverDecisionEngine engine;

    @Inject
    HealthAggregator aggregator;

    @Inject
    ReplicationLagTracker lagTracker;

    void onStart(@Observes StartupEvent event) {
        Gauge.builder("regionguard.failover.mode", engine, e -> e.mode().ordinal())
            .description("Operating mode (0=PRIMARY_ACTIVE, 1=DEGRADED, 2=FAILOVER_PENDING, 3=SECONDARY_ACTIVE, 4=RECOVERING)")
            .register(meterRegistry);

        Gauge.builder("regionguard.failover.automation.halted", engine, e -> e.isAutomationHalted() ? 1 : 0)
            .description("1 while automation is halted after a failed plan")
            .register(meterRegistry);

        Gauge.builder("regionguard.health.ingestion.queue", aggregator, HealthAggregator::queueDepth)
            .description("Health samples waiting for the aggregator")
            .register(meterRegistry);

        for (RegionId region : aggregator.snapshot().keySet()) {
            Gauge.builder("regionguard.replication.lag", lagTracker, t -> lagMillisInto(t, region))
                .tag("receiving_region", region.value())
                .description("Worst replication lag into the region in milliseconds, -1 when stale")
                .baseUnit("milliseconds")
                .register(meterRegistry);

            Gauge.builder("regionguard.region.verdict", aggregator, a -> verdictOrdinal(a, region))
                .tag("region", region.value())
                .description("Region verdict (0=HEALTHY, 1=DEGRADED, 2=UNHEALTHY)")
                .register(meterRegistry);
        }

        aggregator.addListener(this::countTransition);
        LOG.infof("Failover metrics registered for regions %s", aggregator.snapshot().keySet());
    }

    private void countTransition(VerdictTransition transition) {
        Counter.builder("regionguard.region.verdict.transitions")
            .tag("region", transition.regionId().value())
            .tag("to", transition.to().name())
            .description("Region verdict transitions")
            .register(meterRegistry)
            .increment();
    }

    private static double lagMillisInto(ReplicationLagTracker tracker, RegionId region) {
        ReplicationLag lag = tracker.worstLag(region);
        return lag.stale() ? -1 : lag.lagMillis();
    }

    private static double verdictOrdinal(HealthAggregator aggregator, RegionId region) {
        return aggregator.verdict(region).map(HealthVerdict::status).map(Enum::ordinal).orElse(-1);
    }
}
