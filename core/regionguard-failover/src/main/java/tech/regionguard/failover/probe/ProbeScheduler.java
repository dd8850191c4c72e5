package tech.regionguard.failover.probe;

import org.jboss.logging.Logger;
import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.RegionId;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs every (probe, region) pair as its own periodic task, so a slow endpoint
 * never delays the other probes. Each run delivers exactly one sample.
 */
public class ProbeScheduler {

    private static final Logger LOG = Logger.getLogger(ProbeScheduler.class);

    private final List<RegionProbe> probes;
    private final Consumer<HealthSample> sink;
    private final Duration interval;
    private final int threads;
    private final Clock clock;

    private ScheduledExecutorService executor;
    private final List<ScheduledFuture<?>> tasks = new ArrayList<>();

    public ProbeScheduler(List<RegionProbe> probes, Consumer<HealthSample> sink, Duration interval,
                          int threads, Clock clock) {
        this.probes = List.copyOf(probes);
        this.sink = sink;
        this.interval = interval;
        this.threads = threads;
        this.clock = clock;
    }

    /**
     * Probe ids per region, in registration order.
     */
    public Map<RegionId, Set<String>> probeIdsByRegion() {
        return probeIdsByRegion(probes);
    }

    public static Map<RegionId, Set<String>> probeIdsByRegion(List<RegionProbe> probes) {
        Map<RegionId, Set<String>> result = new LinkedHashMap<>();
        for (RegionProbe probe : probes) {
            for (RegionId region : probe.regions()) {
                result.computeIfAbsent(region, r -> new LinkedHashSet<>()).add(probe.id());
            }
        }
        return result;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }

        AtomicInteger threadCounter = new AtomicInteger();
        executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "region-probe-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        long periodMillis = interval.toMillis();
        for (RegionProbe probe : probes) {
            for (RegionId region : probe.regions()) {
                tasks.add(executor.scheduleAtFixedRate(() -> runOnce(probe, region),
                    0, periodMillis, TimeUnit.MILLISECONDS));
            }
        }
        LOG.infof("Probe scheduler started: %d tasks every %dms on %d threads", tasks.size(), periodMillis, threads);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        tasks.forEach(task -> task.cancel(true));
        tasks.clear();
        executor.shutdownNow();
        executor = null;
        LOG.info("Probe scheduler stopped");
    }

    /**
     * Sample once and deliver the result. Never throws, so the periodic task keeps running.
     */
    void runOnce(RegionProbe probe, RegionId region) {
        HealthSample sample;
        try {
            sample = probe.sample(region);
            if (sample == null) {
                sample = HealthSample.failure(region, probe.id(), clock.millis(), null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sample = HealthSample.failure(region, probe.id(), clock.millis(), null);
        } catch (Exception e) {
            LOG.debugf("Probe %s failed for region %s: %s", probe.id(), region, e.toString());
            sample = HealthSample.failure(region, probe.id(), clock.millis(), null);
        }

        try {
            sink.accept(sample);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to deliver sample from probe %s for region %s", probe.id(), region);
        }
    }
}
