package tech.regionguard.failover.health;

import tech.regionguard.failover.model.VerdictTransition;

/**
 * Receives verdict transitions on the aggregator's ingestion thread. Must not block.
 */
@FunctionalInterface
public interface VerdictListener {

    void onTransition(VerdictTransition transition);
}
