package tech.regionguard.failover.model;

import java.time.Instant;

/**
 * Progress of one step within a plan execution.
 */
public record StepProgress(
    CutoverStep step,
    Status status,
    Instant startedAt,
    Instant finishedAt,
    String detail
) {

    public enum Status {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    public static StepProgress pending(CutoverStep step) {
        return new StepProgress(step, Status.PENDING, null, null, null);
    }

    public StepProgress running(Instant now) {
        return new StepProgress(step, Status.RUNNING, now, null, null);
    }

    public StepProgress succeeded(Instant now, String detail) {
        return new StepProgress(step, Status.SUCCEEDED, startedAt, now, detail);
    }

    public StepProgress failed(Instant now, String detail) {
        return new StepProgress(step, Status.FAILED, startedAt, now, detail);
    }
}
