package tech.regionguard.failover.config;

import java.time.Duration;

/**
 * Safety bounds applied by the decision engine.
 *
 * @param rpoBoundMillis maximum replication lag toward a cutover target
 * @param rtoDeadline    time a plan may run before escalation
 * @param autoFailback   execute fail-back proposals without operator confirmation
 */
public record DecisionPolicy(long rpoBoundMillis, Duration rtoDeadline, boolean autoFailback) {

    public DecisionPolicy {
        if (rpoBoundMillis <= 0) {
            throw new IllegalArgumentException("rpo-bound-millis must be positive, was " + rpoBoundMillis);
        }
        if (rtoDeadline == null || rtoDeadline.isNegative() || rtoDeadline.isZero()) {
            throw new IllegalArgumentException("rto-deadline must be positive, was " + rtoDeadline);
        }
    }

    public static DecisionPolicy from(FailoverConfig.Decision config) {
        return new DecisionPolicy(config.rpoBoundMillis(), config.rtoDeadline(), config.autoFailback());
    }
}
