package tech.regionguard.failover.alert;

import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans alerts out to every sink on a background executor.
 * {@link #notify} never blocks and never throws, so decision cycles are not held up by delivery.
 */
public class AlertDispatcher implements AlertSink {

    private static final Logger LOG = Logger.getLogger(AlertDispatcher.class);

    private final List<AlertSink> sinks;
    private final ExecutorService executor;

    public AlertDispatcher(List<AlertSink> sinks, ExecutorService executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
    }

    @Override
    public void notify(AlertSeverity severity, String message) {
        switch (severity) {
            case CRITICAL -> LOG.errorf("ALERT [%s] %s", severity, message);
            case WARNING -> LOG.warnf("ALERT [%s] %s", severity, message);
            default -> LOG.infof("ALERT [%s] %s", severity, message);
        }

        for (AlertSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, severity, message));
            } catch (RejectedExecutionException e) {
                LOG.warnf("Alert dropped for sink %s, dispatcher is shut down: %s", sink.name(), message);
            }
        }
    }

    @Override
    public String name() {
        return "dispatcher";
    }

    private void deliver(AlertSink sink, AlertSeverity severity, String message) {
        try {
            sink.notify(severity, message);
        } catch (Exception e) {
            LOG.warnf(e, "Alert sink %s failed to deliver [%s] alert", sink.name(), severity);
        }
    }
}
