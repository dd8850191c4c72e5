package tech.regionguard.failover.alert;

import org.junit.jupiter.api.Test;
import tech.regionguard.failover.warning.InMemoryWarningService;
import tech.regionguard.failover.warning.Warning;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WarningAlertSinkTest {

    @Test
    void shouldRecordAlertAsUnacknowledgedWarning() {
        // Given
        InMemoryWarningService warnings = new InMemoryWarningService();
        WarningAlertSink sink = new WarningAlertSink(warnings);

        // When
        sink.notify(AlertSeverity.WARNING, "Region SECONDARY health HEALTHY -> DEGRADED");
        sink.notify(AlertSeverity.INFO, "Region SECONDARY health DEGRADED -> HEALTHY");

        // Then
        List<Warning> recorded = warnings.getUnacknowledgedWarnings();
        assertEquals(2, recorded.size());
        Warning degraded = recorded.stream()
            .filter(w -> w.severity().equals("WARNING"))
            .findFirst()
            .orElseThrow();
        assertEquals("FAILOVER", degraded.category());
        assertEquals("RegionGuard", degraded.source());
        assertEquals("Region SECONDARY health HEALTHY -> DEGRADED", degraded.message());
        assertTrue(recorded.stream().anyMatch(w -> w.severity().equals("INFO")));
    }

    @Test
    void shouldBeNamedForLogs() {
        assertEquals("warnings", new WarningAlertSink(new InMemoryWarningService()).name());
    }
}
