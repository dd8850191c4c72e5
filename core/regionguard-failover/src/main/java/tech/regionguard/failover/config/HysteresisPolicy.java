package tech.regionguard.failover.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Validated thresholds for verdict transitions.
 *
 * @param failureRounds          K, failing rounds to leave HEALTHY
 * @param unhealthyRounds        K2, further failing rounds to reach UNHEALTHY
 * @param degradedRecoveryRounds Kd, successful rounds to leave DEGRADED
 * @param recoveryRounds         R, successful rounds to leave UNHEALTHY
 * @param window                 W, maximum lifetime of an open round
 */
public record HysteresisPolicy(
    int failureRounds,
    int unhealthyRounds,
    int degradedRecoveryRounds,
    int recoveryRounds,
    Duration window
) {

    public HysteresisPolicy {
        Objects.requireNonNull(window, "window");
        if (failureRounds < 1) {
            throw new IllegalArgumentException("failure-rounds (K) must be at least 1, was " + failureRounds);
        }
        if (unhealthyRounds < 1) {
            throw new IllegalArgumentException("unhealthy-rounds (K2) must be at least 1, was " + unhealthyRounds);
        }
        if (degradedRecoveryRounds < failureRounds) {
            throw new IllegalArgumentException("degraded-recovery-rounds (Kd=" + degradedRecoveryRounds +
                ") must be >= failure-rounds (K=" + failureRounds + ")");
        }
        if (recoveryRounds <= failureRounds + unhealthyRounds) {
            throw new IllegalArgumentException("recovery-rounds (R=" + recoveryRounds +
                ") must be greater than K + K2 (" + (failureRounds + unhealthyRounds) + ")");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window (W) must be positive, was " + window);
        }
    }

    public static HysteresisPolicy from(FailoverConfig.Hysteresis config) {
        return new HysteresisPolicy(
            config.failureRounds(),
            config.unhealthyRounds(),
            config.degradedRecoveryRounds(),
            config.recoveryRounds(),
            config.window()
        );
    }
}
