package tech.regionguard.failover.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recorded progress of a cutover plan. Each mutation returns a new instance.
 *
 * @param lastSuccessfulStep 1-based number of the last completed step, 0 if none
 * @param committed          a step with an external side effect has completed
 * @param leaseEpoch         orchestrator lease epoch of the instance driving the plan, 0 before it is claimed
 */
@Schema(description = "Execution state of a cutover plan")
public record CutoverExecution(
    CutoverPlan plan,
    Status status,
    List<StepProgress> steps,
    int lastSuccessfulStep,
    String failureMessage,
    boolean committed,
    Instant startedAt,
    Instant completedAt,
    long leaseEpoch
) {

    public enum Status {
        IN_PROGRESS,
        SUCCEEDED,
        FAILED,
        PARTIAL,
        CANCELLED;

        public boolean isTerminal() {
            return this != IN_PROGRESS;
        }
    }

    public CutoverExecution {
        steps = List.copyOf(steps);
    }

    public static CutoverExecution start(CutoverPlan plan, Instant now) {
        List<StepProgress> progress = plan.steps().stream().map(StepProgress::pending).toList();
        return new CutoverExecution(plan, Status.IN_PROGRESS, progress, 0, null, false, now, null, 0);
    }

    public String planId() {
        return plan.planId();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * @return the first step that has not succeeded yet
     */
    public Optional<CutoverStep> nextStep() {
        return steps.stream()
            .filter(p -> p.status() != StepProgress.Status.SUCCEEDED)
            .map(StepProgress::step)
            .findFirst();
    }

    public boolean hasSucceeded(CutoverStep step) {
        return steps.stream().anyMatch(p -> p.step() == step && p.status() == StepProgress.Status.SUCCEEDED);
    }

    /**
     * @return a step with an external side effect has started, so storage or traffic may have moved
     *         even if the step did not complete
     */
    public boolean reachedSideEffects() {
        return steps.stream()
            .anyMatch(p -> p.step().hasExternalSideEffect() && p.status() != StepProgress.Status.PENDING);
    }

    public CutoverExecution withStep(StepProgress progress) {
        List<StepProgress> updated = new ArrayList<>(steps);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).step() == progress.step()) {
                updated.set(i, progress);
            }
        }
        int last = lastSuccessfulStep;
        boolean nowCommitted = committed;
        if (progress.status() == StepProgress.Status.SUCCEEDED) {
            last = Math.max(last, progress.step().number());
            nowCommitted = committed || progress.step().hasExternalSideEffect();
        }
        return new CutoverExecution(plan, status, updated, last, failureMessage, nowCommitted, startedAt, completedAt,
            leaseEpoch);
    }

    public CutoverExecution finish(Status outcome, String message, Instant now) {
        return new CutoverExecution(plan, outcome, steps, lastSuccessfulStep, message, committed, startedAt, now,
            leaseEpoch);
    }

    public CutoverExecution withLeaseEpoch(long epoch) {
        return new CutoverExecution(plan, status, steps, lastSuccessfulStep, failureMessage, committed, startedAt,
            completedAt, epoch);
    }
}
