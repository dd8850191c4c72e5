package tech.regionguard.failover.replication;

import org.jboss.logging.Logger;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLagSample;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Feeds the lag tracker from CloudWatch replication metrics. Only pairs replicating out of
 * the currently active region are polled. A pair whose metric cannot be read simply stops
 * updating and turns stale.
 *
 * <p>CloudWatch stamps a datapoint with the start of its period and publishes it some time
 * after the period ends, so the newest datapoint is always older than the poll. Samples are
 * recorded at the time they were read. A datapoint older than {@link #MAX_DATAPOINT_AGE}
 * means the metric stopped flowing and is not recorded.</p>
 */
public class CloudWatchReplicationLagPoller {

    private static final Logger LOG = Logger.getLogger(CloudWatchReplicationLagPoller.class);
    private static final Duration LOOKBACK = Duration.ofMinutes(5);
    private static final int PERIOD_SECONDS = 60;
    private static final Duration PUBLICATION_DELAY = Duration.ofMinutes(2);
    static final Duration MAX_DATAPOINT_AGE = Duration.ofSeconds(PERIOD_SECONDS).plus(PUBLICATION_DELAY);

    private final Map<RegionId, CloudWatchClient> clients;
    private final List<LagMetricSource> sources;
    private final ReplicationLagTracker tracker;
    private final Supplier<RegionId> activeRegion;
    private final Clock clock;

    public CloudWatchReplicationLagPoller(Map<RegionId, CloudWatchClient> clients, List<LagMetricSource> sources,
                                          ReplicationLagTracker tracker, Supplier<RegionId> activeRegion, Clock clock) {
        this.clients = Map.copyOf(clients);
        this.sources = List.copyOf(sources);
        this.tracker = tracker;
        this.activeRegion = activeRegion;
        this.clock = clock;
    }

    /**
     * Fail unless a pair polled on schedule stays fresh until the following poll. The tracker
     * turns a pair stale after twice the expected interval.
     *
     * @throws IllegalArgumentException if the poll interval exceeds the expected interval
     */
    public static void requireFreshBetweenPolls(Duration expectedInterval, Duration pollInterval) {
        if (pollInterval.compareTo(expectedInterval) > 0) {
            throw new IllegalArgumentException("failover.replication.poll-interval (" + pollInterval
                + ") must not exceed failover.replication.expected-interval (" + expectedInterval
                + "), CloudWatch lag would read stale between polls");
        }
    }

    /**
     * @return number of samples recorded
     */
    public int poll() {
        RegionId source = activeRegion.get();
        int recorded = 0;
        for (LagMetricSource metric : sources) {
            if (!metric.sourceRegion().equals(source)) {
                continue;
            }
            try {
                Instant now = clock.instant();
                Optional<Datapoint> latest = latestDatapoint(metric, now);
                if (latest.isPresent() && latest.get().maximum() != null) {
                    Datapoint datapoint = latest.get();
                    if (datapoint.timestamp().isBefore(now.minus(MAX_DATAPOINT_AGE))) {
                        LOG.warnf("Newest %s datapoint for store %s -> %s is from %s, not recording",
                            metric.metricName(), metric.storeId(), metric.receivingRegion(), datapoint.timestamp());
                        continue;
                    }
                    long lagMillis = Math.round(datapoint.maximum() * metric.millisPerUnit());
                    if (tracker.record(new ReplicationLagSample(metric.storeId(), metric.receivingRegion(),
                            lagMillis, now.toEpochMilli()))) {
                        recorded++;
                    }
                } else {
                    LOG.debugf("No %s datapoints for store %s -> %s", metric.metricName(),
                        metric.storeId(), metric.receivingRegion());
                }
            } catch (Exception e) {
                LOG.warnf("Failed to read %s for store %s -> %s: %s", metric.metricName(),
                    metric.storeId(), metric.receivingRegion(), e.getMessage());
            }
        }
        return recorded;
    }

    private Optional<Datapoint> latestDatapoint(LagMetricSource metric, Instant end) {
        CloudWatchClient client = clients.get(metric.queryRegion());
        if (client == null) {
            throw new IllegalStateException("No CloudWatch client for region " + metric.queryRegion());
        }

        GetMetricStatisticsRequest request = GetMetricStatisticsRequest.builder()
            .namespace(metric.namespace())
            .metricName(metric.metricName())
            .dimensions(metric.dimensions().entrySet().stream()
                .map(d -> Dimension.builder().name(d.getKey()).value(d.getValue()).build())
                .toList())
            .startTime(end.minus(LOOKBACK))
            .endTime(end)
            .period(PERIOD_SECONDS)
            .statistics(Statistic.MAXIMUM)
            .build();

        return client.getMetricStatistics(request).datapoints().stream()
            .max(Comparator.comparing(Datapoint::timestamp));
    }
}
