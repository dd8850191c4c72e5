package tech.regionguard.failover.alert;

import tech.regionguard.failover.warning.WarningService;

/**
 * Records alerts in the warning store shown to operators.
 */
public class WarningAlertSink implements AlertSink {

    private final WarningService warningService;

    public WarningAlertSink(WarningService warningService) {
        this.warningService = warningService;
    }

    @Override
    public void notify(AlertSeverity severity, String message) {
        warningService.addWarning("FAILOVER", severity.name(), message, "RegionGuard");
    }

    @Override
    public String name() {
        return "warnings";
    }
}
