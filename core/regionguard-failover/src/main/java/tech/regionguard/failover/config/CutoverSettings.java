package tech.regionguard.failover.config;

import java.time.Duration;

/**
 * Timeouts and drain thresholds for executing a cutover plan.
 */
public record CutoverSettings(
    Duration stepTimeout,
    long drainThresholdMillis,
    Duration drainTimeout,
    Duration drainPollInterval,
    long acceptedDataLossMillis
) {

    public CutoverSettings {
        if (stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("step-timeout must be positive");
        }
        if (drainPollInterval.isNegative() || drainPollInterval.isZero()) {
            throw new IllegalArgumentException("drain-poll-interval must be positive");
        }
        if (acceptedDataLossMillis < drainThresholdMillis) {
            throw new IllegalArgumentException("accepted-data-loss-millis (" + acceptedDataLossMillis +
                ") must be >= drain-threshold-millis (" + drainThresholdMillis + ")");
        }
    }

    /**
     * The drain step polls for up to the drain timeout, so it gets that on top of the normal step budget.
     */
    public Duration drainStepTimeout() {
        return drainTimeout.plus(stepTimeout);
    }

    public static CutoverSettings from(FailoverConfig.Cutover config) {
        return new CutoverSettings(
            config.stepTimeout(),
            config.drainThresholdMillis(),
            config.drainTimeout(),
            config.drainPollInterval(),
            config.acceptedDataLossMillis()
        );
    }
}
