package tech.regionguard.lease;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Leadership lease configuration for running the orchestrator as an active/passive pair.
 * When enabled, a Redis key decides which instance may evaluate failover decisions.
 * Disabled by default - a single orchestrator instance is always the leader.
 */
@ConfigMapping(prefix = "orchestrator-lease")
public interface LeaseConfig {

    /**
     * Enable the Redis-backed leadership lease.
     * If false, this instance acts as leader without any Redis dependency.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Unique identifier for this orchestrator instance.
     * Defaults to HOSTNAME environment variable or "orchestrator-1".
     */
    @WithDefault("${HOSTNAME:orchestrator-1}")
    String instanceId();

    /**
     * Redis key holding the lease. Orchestrators guarding different deployments
     * must use different keys.
     */
    @WithDefault("regionguard-orchestrator-lease")
    String leaseKey();

    /**
     * Lease TTL in seconds. A leader that cannot renew for this long steps down,
     * since its peer may already hold a newer epoch.
     */
    @WithDefault("30")
    int leaseTtlSeconds();

    /**
     * How often the leader renews and a follower tries to acquire. Keep well below the TTL.
     */
    @WithDefault("10s")
    Duration renewInterval();
}
