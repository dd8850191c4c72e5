package tech.regionguard.failover.probe;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import tech.regionguard.failover.model.HealthSample;
import tech.regionguard.failover.model.RegionId;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProbeSchedulerTest {

    private final Clock clock = Clock.systemUTC();
    private final List<HealthSample> delivered = new CopyOnWriteArrayList<>();

    private ProbeScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void shouldGroupProbeIdsByRegion() {
        RegionProbe a = probe("http-0", RegionId.PRIMARY, RegionId.SECONDARY);
        RegionProbe b = probe("http-1", RegionId.PRIMARY);

        Map<RegionId, Set<String>> ids = ProbeScheduler.probeIdsByRegion(List.of(a, b));

        assertEquals(Set.of("http-0", "http-1"), ids.get(RegionId.PRIMARY));
        assertEquals(Set.of("http-0"), ids.get(RegionId.SECONDARY));
    }

    @Test
    void shouldTurnProbeExceptionIntoFailedSample() throws Exception {
        // Given
        RegionProbe failing = probe("http-0", RegionId.PRIMARY);
        when(failing.sample(RegionId.PRIMARY)).thenThrow(new IllegalStateException("connection refused"));
        scheduler = new ProbeScheduler(List.of(failing), delivered::add, Duration.ofSeconds(10), 1, clock);

        // When
        scheduler.runOnce(failing, RegionId.PRIMARY);

        // Then
        assertEquals(1, delivered.size());
        assertFalse(delivered.get(0).success());
        assertEquals("http-0", delivered.get(0).probeId());
    }

    @Test
    void shouldTurnMissingSampleIntoFailure() throws Exception {
        RegionProbe silent = probe("http-0", RegionId.PRIMARY);
        when(silent.sample(RegionId.PRIMARY)).thenReturn(null);
        scheduler = new ProbeScheduler(List.of(silent), delivered::add, Duration.ofSeconds(10), 1, clock);

        scheduler.runOnce(silent, RegionId.PRIMARY);

        assertFalse(delivered.get(0).success());
    }

    @Test
    void shouldSampleEveryProbeAndRegionPeriodically() throws Exception {
        // Given
        RegionProbe probe = probe("http-0", RegionId.PRIMARY, RegionId.SECONDARY);
        when(probe.sample(any())).thenAnswer(invocation ->
            HealthSample.success(invocation.getArgument(0), "http-0", clock.millis(), 5L));
        scheduler = new ProbeScheduler(List.of(probe), delivered::add, Duration.ofMillis(50), 2, clock);

        // When
        scheduler.start();

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() ->
            delivered.stream().filter(s -> s.regionId().equals(RegionId.PRIMARY)).count() >= 2
                && delivered.stream().filter(s -> s.regionId().equals(RegionId.SECONDARY)).count() >= 2);
    }

    private static RegionProbe probe(String id, RegionId... regions) {
        RegionProbe probe = mock(RegionProbe.class);
        when(probe.id()).thenReturn(id);
        when(probe.regions()).thenReturn(Set.of(regions));
        return probe;
    }
}
