package tech.regionguard.failover.replication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import tech.regionguard.failover.MutableClock;
import tech.regionguard.failover.model.RegionId;
import tech.regionguard.failover.model.ReplicationLag;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CloudWatchReplicationLagPollerTest {

    private static final Duration EXPECTED_INTERVAL = Duration.ofSeconds(30);

    private MutableClock clock;
    private ReplicationLagTracker tracker;
    private CloudWatchClient primaryCloudWatch;
    private CloudWatchClient secondaryCloudWatch;
    private AtomicReference<RegionId> activeRegion;
    private CloudWatchReplicationLagPoller poller;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        tracker = new ReplicationLagTracker(clock, EXPECTED_INTERVAL);
        tracker.register("orders", RegionId.SECONDARY);
        tracker.register("orders", RegionId.PRIMARY);
        primaryCloudWatch = mock(CloudWatchClient.class);
        secondaryCloudWatch = mock(CloudWatchClient.class);
        activeRegion = new AtomicReference<>(RegionId.PRIMARY);

        List<LagMetricSource> sources = List.of(
            dynamoSource(RegionId.PRIMARY, RegionId.SECONDARY, "us-west-2"),
            dynamoSource(RegionId.SECONDARY, RegionId.PRIMARY, "us-east-1"));
        poller = new CloudWatchReplicationLagPoller(
            Map.of(RegionId.PRIMARY, primaryCloudWatch, RegionId.SECONDARY, secondaryCloudWatch),
            sources, tracker, activeRegion::get, clock);
    }

    @Test
    void shouldKeepLagFreshUntilNextPollAlthoughDatapointStartedAMinuteAgo() {
        // Given: the newest complete datapoint always lags the poll by at least one period
        returnDatapoints(primaryCloudWatch, datapoint(clock.instant().minusSeconds(60), 150.0));

        // When
        int recorded = poller.poll();
        clock.advance(Duration.ofSeconds(1));

        // Then
        assertEquals(1, recorded);
        ReplicationLag lag = tracker.worstLag(RegionId.SECONDARY);
        assertFalse(lag.stale());
        assertEquals(150, lag.lagMillis());
        assertTrue(lag.isWithin(5000));

        // And still fresh just before the next scheduled poll
        clock.advance(EXPECTED_INTERVAL.minusSeconds(2));
        assertFalse(tracker.worstLag(RegionId.SECONDARY).stale());
    }

    @Test
    void shouldTurnStaleWhenPollsStopReturningData() {
        // Given
        returnDatapoints(primaryCloudWatch, datapoint(clock.instant().minusSeconds(60), 150.0));
        poller.poll();

        // When
        clock.advance(EXPECTED_INTERVAL.multipliedBy(2).plusSeconds(1));

        // Then
        assertTrue(tracker.worstLag(RegionId.SECONDARY).stale());
    }

    @Test
    void shouldUseNewestDatapoint() {
        Instant now = clock.instant();
        returnDatapoints(primaryCloudWatch,
            datapoint(now.minusSeconds(180), 900.0),
            datapoint(now.minusSeconds(60), 150.0),
            datapoint(now.minusSeconds(120), 400.0));

        poller.poll();

        assertEquals(150, tracker.worstLag(RegionId.SECONDARY).lagMillis());
    }

    @Test
    void shouldNotRecordDatapointOlderThanPublicationWindow() {
        // Given: the metric stopped flowing four minutes ago
        returnDatapoints(primaryCloudWatch, datapoint(clock.instant().minus(Duration.ofMinutes(4)), 150.0));

        // When
        int recorded = poller.poll();

        // Then
        assertEquals(0, recorded);
        assertTrue(tracker.worstLag(RegionId.SECONDARY).stale());
    }

    @Test
    void shouldIgnoreDatapointWithoutMaximum() {
        returnDatapoints(primaryCloudWatch, Datapoint.builder().timestamp(clock.instant().minusSeconds(60)).build());

        assertEquals(0, poller.poll());
        assertTrue(tracker.worstLag(RegionId.SECONDARY).stale());
    }

    @Test
    void shouldOnlyPollPairsReplicatingOutOfActiveRegion() {
        // Given
        returnDatapoints(primaryCloudWatch, datapoint(clock.instant().minusSeconds(60), 150.0));

        // When
        poller.poll();

        // Then
        ArgumentCaptor<GetMetricStatisticsRequest> captor = ArgumentCaptor.forClass(GetMetricStatisticsRequest.class);
        verify(primaryCloudWatch).getMetricStatistics(captor.capture());
        GetMetricStatisticsRequest request = captor.getValue();
        assertEquals("AWS/DynamoDB", request.namespace());
        assertEquals("ReplicationLatency", request.metricName());
        assertTrue(request.dimensions().contains(Dimension.builder().name("ReceivingRegion").value("us-west-2").build()));
        verifyNoInteractions(secondaryCloudWatch);
    }

    @Test
    void shouldPollReverseDirectionAfterFailover() {
        // Given
        activeRegion.set(RegionId.SECONDARY);
        returnDatapoints(secondaryCloudWatch, datapoint(clock.instant().minusSeconds(60), 80.0));

        // When
        poller.poll();

        // Then
        assertEquals(80, tracker.worstLag(RegionId.PRIMARY).lagMillis());
        assertFalse(tracker.worstLag(RegionId.PRIMARY).stale());
        verifyNoInteractions(primaryCloudWatch);
    }

    @Test
    void shouldSkipSourceWithoutCloudWatchClient() {
        CloudWatchReplicationLagPoller partial = new CloudWatchReplicationLagPoller(
            Map.of(RegionId.SECONDARY, secondaryCloudWatch),
            List.of(dynamoSource(RegionId.PRIMARY, RegionId.SECONDARY, "us-west-2")),
            tracker, activeRegion::get, clock);

        assertEquals(0, partial.poll());
        assertTrue(tracker.worstLag(RegionId.SECONDARY).stale());
    }

    @Test
    void shouldKeepPollingOtherSourcesWhenOneFails() {
        // Given
        LagMetricSource failing = new LagMetricSource("ledger", RegionId.PRIMARY, RegionId.SECONDARY,
            RegionId.PRIMARY, "AWS/RDS", "AuroraGlobalDBReplicationLag", Map.of("DBClusterIdentifier", "ledger"), 1.0);
        when(primaryCloudWatch.getMetricStatistics(any(GetMetricStatisticsRequest.class)))
            .thenThrow(CloudWatchException.builder().message("Throttling").build())
            .thenReturn(GetMetricStatisticsResponse.builder()
                .datapoints(datapoint(clock.instant().minusSeconds(60), 150.0))
                .build());
        CloudWatchReplicationLagPoller mixed = new CloudWatchReplicationLagPoller(
            Map.of(RegionId.PRIMARY, primaryCloudWatch),
            List.of(failing, dynamoSource(RegionId.PRIMARY, RegionId.SECONDARY, "us-west-2")),
            tracker, activeRegion::get, clock);

        // When
        int recorded = mixed.poll();

        // Then
        assertEquals(1, recorded);
        assertEquals(150, tracker.currentLag("orders").lagMillis());
    }

    @Test
    void shouldRejectPollIntervalLongerThanExpectedInterval() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> CloudWatchReplicationLagPoller.requireFreshBetweenPolls(Duration.ofSeconds(30), Duration.ofSeconds(60)));

        assertTrue(e.getMessage().contains("poll-interval"));
        assertDoesNotThrow(
            () -> CloudWatchReplicationLagPoller.requireFreshBetweenPolls(Duration.ofSeconds(30), Duration.ofSeconds(30)));
    }

    private static LagMetricSource dynamoSource(RegionId source, RegionId receiving, String receivingAwsRegion) {
        return new LagMetricSource("orders", source, receiving, source, "AWS/DynamoDB", "ReplicationLatency",
            Map.of("TableName", "orders", "ReceivingRegion", receivingAwsRegion), 1.0);
    }

    private static Datapoint datapoint(Instant timestamp, double maximum) {
        return Datapoint.builder().timestamp(timestamp).maximum(maximum).build();
    }

    private static void returnDatapoints(CloudWatchClient client, Datapoint... datapoints) {
        when(client.getMetricStatistics(any(GetMetricStatisticsRequest.class)))
            .thenReturn(GetMetricStatisticsResponse.builder().datapoints(datapoints).build());
    }
}
