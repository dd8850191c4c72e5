package tech.regionguard.failover.metrics;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import tech.regionguard.failover.decision.EngineStatus;
import tech.regionguard.failover.decision.FailoverDecisionEngine;

/**
 * Readiness check reporting the operating mode and whether this instance decides.
 * DOWN only when the engine status cannot be read.
 */
@ApplicationScoped
@Readiness
public class FailoverReadinessCheck implements HealthCheck {

    @Inject
    FailoverDecisionEngine engine;

    @Override
    public HealthCheckResponse call() {
        try {
            EngineStatus status = engine.status();
            return HealthCheckResponse.builder()
                .name("Failover")
                .up()
                .withData("mode", status.mode().name())
                .withData("activeRegion", String.valueOf(status.activeRegion()))
                .withData("role", status.leader() ? "LEADER" : "FOLLOWER")
                .withData("automationHalted", status.automationHalted())
                .withData("currentPlan", String.valueOf(status.currentPlanId()))
                .withData("unresolvedPlan", String.valueOf(status.unresolvedPlanId()))
                .build();
        } catch (Exception e) {
            return HealthCheckResponse.builder()
                .name("Failover")
                .down()
                .withData("error", String.valueOf(e.getMessage()))
                .build();
        }
    }
}
