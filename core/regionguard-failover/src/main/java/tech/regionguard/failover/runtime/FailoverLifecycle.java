package tech.regionguard.failover.runtime;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.regionguard.failover.config.CutoverSettings;
import tech.regionguard.failover.config.DecisionPolicy;
import tech.regionguard.failover.config.FailoverConfig;
import tech.regionguard.failover.config.HysteresisPolicy;
import tech.regionguard.failover.decision.FailoverDecisionEngine;
import tech.regionguard.failover.health.HealthAggregator;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.probe.ProbeScheduler;
import tech.regionguard.failover.replication.CloudWatchReplicationLagPoller;
import tech.regionguard.failover.state.FailoverStateStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Starts monitoring on application start and stops it on shutdown.
 *
 * <p>Invalid thresholds or region settings fail the start.</p>
 */
@ApplicationScoped
public class FailoverLifecycle {

    private static final Logger LOG = Logger.getLogger(FailoverLifecycle.class);

    @Inject
    FailoverConfig config;

    @Inject
    HysteresisPolicy hysteresisPolicy;

    @Inject
    DecisionPolicy decisionPolicy;

    @Inject
    CutoverSettings cutoverSettings;

    @Inject
    FailoverStateStore stateStore;

    @Inject
    HealthAggregator aggregator;

    @Inject
    ProbeScheduler probeScheduler;

    @Inject
    FailoverDecisionEngine engine;

    void onStart(@Observes StartupEvent event) {
        validateRegions();
        if (config.replication().cloudwatchEnabled()) {
            CloudWatchReplicationLagPoller.requireFreshBetweenPolls(config.replication().expectedInterval(),
                config.replication().pollInterval());
        }
        LOG.infof("RegionGuard starting: primary=%s, secondary=%s, %s, RPO bound %dms, RTO deadline %s",
            config.primaryRegion(), config.secondaryRegion(), hysteresisPolicy, decisionPolicy.rpoBoundMillis(),
            decisionPolicy.rtoDeadline());
        LOG.debugf("Cutover settings: %s", cutoverSettings);

        aggregator.restore(stateStore.loadVerdicts());
        aggregator.addListener(transition -> saveVerdicts());
        aggregator.addListener(engine);
        engine.initialize();

        aggregator.start();
        probeScheduler.start();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("RegionGuard shutting down");
        probeScheduler.stop();
        aggregator.stop();
        saveVerdicts();
    }

    private void validateRegions() {
        List<String> missing = new ArrayList<>();
        for (String region : List.of(config.primaryRegion(), config.secondaryRegion())) {
            if (!config.regions().containsKey(region)) {
                missing.add(region);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing failover.regions settings for " + missing);
        }
        if (config.primaryRegion().equals(config.secondaryRegion())) {
            throw new IllegalStateException("failover.primary-region and failover.secondary-region must differ");
        }
        Set<RegionId> probed = probeScheduler.probeIdsByRegion().keySet();
        for (String region : List.of(config.primaryRegion(), config.secondaryRegion())) {
            if (!probed.contains(RegionId.of(region))) {
                throw new IllegalStateException("Region " + region + " has no probes, configure failover.regions."
                    + region + ".health-endpoints or enable the routing health-check probe");
            }
        }
    }

    private void saveVerdicts() {
        try {
            stateStore.saveVerdicts(new ArrayList<HealthVerdict>(aggregator.snapshot().values()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist health verdicts");
        }
    }
}
