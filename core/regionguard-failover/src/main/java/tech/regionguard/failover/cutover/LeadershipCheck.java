package tech.regionguard.failover.cutover;

import java.util.OptionalLong;

/**
 * Orchestrator lease as seen by plan execution. The epoch acts as a fencing token: it grows
 * every time the lease changes hands, so an instance that lost the lease can never confirm
 * the epoch it started a plan with.
 */
public interface LeadershipCheck {

    /**
     * @return epoch of the lease held by this instance, empty while it is a follower
     */
    OptionalLong currentEpoch();

    /**
     * Re-check with the lease store that this instance still holds the given epoch.
     * Called before every plan step that touches another system.
     *
     * @return false if the lease moved on or could not be confirmed
     */
    boolean confirm(long epoch);
}
