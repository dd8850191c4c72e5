package tech.regionguard.failover.warning;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@ApplicationScoped
public class InMemoryWarningService implements WarningService {

    private static final Logger LOG = Logger.getLogger(InMemoryWarningService.class);
    private static final int MAX_WARNINGS = 1000;
    private static final Comparator<Warning> NEWEST_FIRST = Comparator.comparing(Warning::timestamp).reversed();

    private final ConcurrentMap<String, Warning> warnings = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWarningService() {
        this(Clock.systemUTC());
    }

    InMemoryWarningService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String addWarning(String category, String severity, String message, String source) {
        if (warnings.size() >= MAX_WARNINGS) {
            warnings.values().stream()
                .min(Comparator.comparing(Warning::timestamp))
                .ifPresent(oldest -> warnings.remove(oldest.id()));
        }

        String warningId = UUID.randomUUID().toString();
        warnings.put(warningId, new Warning(warningId, category, severity, message, clock.instant(), source, false));
        LOG.infof("Warning added: [%s] %s - %s - %s", severity, category, source, message);
        return warningId;
    }

    @Override
    public List<Warning> getAllWarnings() {
        return warnings.values().stream().sorted(NEWEST_FIRST).toList();
    }

    @Override
    public List<Warning> getUnacknowledgedWarnings() {
        return warnings.values().stream()
            .filter(w -> !w.acknowledged())
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public boolean acknowledgeWarning(String warningId) {
        Warning existing = warnings.computeIfPresent(warningId, (id, w) ->
            new Warning(w.id(), w.category(), w.severity(), w.message(), w.timestamp(), w.source(), true));
        if (existing != null) {
            LOG.infof("Warning acknowledged: %s", warningId);
            return true;
        }
        return false;
    }

    @Override
    public void clearOldWarnings(int hoursOld) {
        Instant threshold = clock.instant().minus(hoursOld, ChronoUnit.HOURS);
        List<String> toRemove = warnings.values().stream()
            .filter(w -> w.timestamp().isBefore(threshold))
            .map(Warning::id)
            .toList();

        toRemove.forEach(warnings::remove);
        if (!toRemove.isEmpty()) {
            LOG.infof("Cleared %d warnings older than %d hours", toRemove.size(), hoursOld);
        }
    }
}
