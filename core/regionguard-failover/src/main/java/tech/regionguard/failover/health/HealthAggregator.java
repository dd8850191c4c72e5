package tech.regionguard.failover.health;

import org.jboss.logging.Logger;
import tech.regionguard.failover.config.HysteresisPolicy;
import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.HealthVerdict;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.VerdictTransition;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Reduces probe samples into one verdict per region.
 *
 * <p>Samples from all probes go through one queue and are applied by a single ingestion
 * thread, so verdicts have exactly one writer. Readers get immutable snapshots. The
 * aggregator also holds the active region, updated by the decision engine when a cutover
 * completes.</p>
 */
public class HealthAggregator {

    private static final Logger LOG = Logger.getLogger(HealthAggregator.class);
    private static final long TICK_MILLIS = 1000;
    private static final int MIN_PROBES_PER_REGION = 2;

    private final Map<RegionId, RegionVerdictTracker> trackers = new LinkedHashMap<>();
    private final BlockingQueue<HealthSample> queue = new LinkedBlockingQueue<>();
    private final List<VerdictListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    private volatile Map<RegionId, HealthVerdict> snapshot;
    private volatile RegionId activeRegion;
    private volatile boolean running;
    private Thread ingestionThread;

    public HealthAggregator(Map<RegionId, Set<String>> probesByRegion, HysteresisPolicy policy,
                            RegionId initialActiveRegion, Clock clock) {
        this.clock = clock;
        this.activeRegion = initialActiveRegion;
        probesByRegion.forEach((region, probes) -> {
            if (probes.size() < MIN_PROBES_PER_REGION) {
                LOG.warnf("Region %s has only %d probe(s) - quorum needs at least %d independent probes",
                    region, probes.size(), MIN_PROBES_PER_REGION);
            }
            trackers.put(region, new RegionVerdictTracker(region, probes, policy, clock.instant()));
        });
        publishSnapshot();
    }

    /**
     * Restore persisted verdicts. Only allowed before {@link #start()}.
     */
    public synchronized void restore(Collection<HealthVerdict> verdicts) {
        if (running) {
            throw new IllegalStateException("Cannot restore verdicts while ingesting");
        }
        for (HealthVerdict verdict : verdicts) {
            RegionVerdictTracker tracker = trackers.get(verdict.regionId());
            if (tracker != null) {
                tracker.restore(verdict);
                LOG.infof("Restored verdict for %s: %s", verdict.regionId(), verdict.status());
            }
        }
        publishSnapshot();
    }

    public void addListener(VerdictListener listener) {
        listeners.add(listener);
    }

    /**
     * Queue a sample for ingestion. Safe to call from any thread.
     */
    public void submit(HealthSample sample) {
        queue.offer(sample);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        ingestionThread = new Thread(this::ingestLoop, "health-aggregator");
        ingestionThread.setDaemon(true);
        ingestionThread.start();
        LOG.infof("Health aggregator started for regions %s", trackers.keySet());
    }

    public synchronized void stop() {
        running = false;
        if (ingestionThread != null) {
            ingestionThread.interrupt();
            ingestionThread = null;
        }
    }

    /**
     * Immutable view of every region's verdict.
     */
    public Map<RegionId, HealthVerdict> snapshot() {
        return snapshot;
    }

    public Optional<HealthVerdict> verdict(RegionId regionId) {
        return Optional.ofNullable(snapshot.get(regionId));
    }

    public RegionId activeRegion() {
        return activeRegion;
    }

    public void setActiveRegion(RegionId regionId) {
        RegionId previous = this.activeRegion;
        this.activeRegion = regionId;
        if (!regionId.equals(previous)) {
            LOG.infof("Active region changed: %s -> %s", previous, regionId);
        }
    }

    public int queueDepth() {
        return queue.size();
    }

    private void ingestLoop() {
        while (running) {
            try {
                HealthSample sample = queue.poll(TICK_MILLIS, TimeUnit.MILLISECONDS);
                List<VerdictTransition> transitions = new ArrayList<>();
                if (sample != null) {
                    RegionVerdictTracker tracker = trackers.get(sample.regionId());
                    if (tracker == null) {
                        LOG.debugf("Ignoring sample for unmonitored region %s", sample.regionId());
                    } else {
                        transitions.addAll(tracker.onSample(sample));
                    }
                }
                long now = clock.millis();
                for (RegionVerdictTracker tracker : trackers.values()) {
                    tracker.onTick(now).ifPresent(transitions::add);
                }
                if (sample != null || !transitions.isEmpty()) {
                    publishSnapshot();
                }
                transitions.forEach(this::notifyListeners);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                LOG.errorf(e, "Unexpected error in health aggregator ingestion");
            }
        }
        LOG.info("Health aggregator stopped");
    }

    private void publishSnapshot() {
        Map<RegionId, HealthVerdict> next = new LinkedHashMap<>();
        trackers.forEach((region, tracker) -> next.put(region, tracker.verdict()));
        snapshot = Map.copyOf(next);
    }

    private void notifyListeners(VerdictTransition transition) {
        for (VerdictListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (Exception e) {
                LOG.errorf(e, "Verdict listener failed for %s transition", transition.regionId());
            }
        }
    }
}
