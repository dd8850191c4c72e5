package tech.regionguard.lease;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness of the orchestrator lease. DOWN only when the lease is enabled and Redis is
 * unreachable; a healthy follower is ready.
 */
@ApplicationScoped
@Readiness
public class LeadershipHealthCheck implements HealthCheck {

    @Inject
    LeadershipService leadershipService;

    @Override
    public HealthCheckResponse call() {
        LeadershipService.LeadershipStatus status = leadershipService.getStatus();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("OrchestratorLease")
                .withData("instance", status.instanceId())
                .withData("role", status.leader() ? "LEADER" : "FOLLOWER")
                .withData("epoch", status.epoch());

        if (!status.leaseEnabled()) {
            return builder.up().withData("mode", "single-instance").build();
        }
        if (!status.redisAvailable()) {
            return builder.down().withData("reason", "Redis unavailable, lease cannot be confirmed").build();
        }
        return builder.up()
                .withData("currentHolder", String.valueOf(status.currentHolder()))
                .withData("lastConfirmed", status.lastConfirmed() != null ? status.lastConfirmed().toString() : "never")
                .build();
    }
}
