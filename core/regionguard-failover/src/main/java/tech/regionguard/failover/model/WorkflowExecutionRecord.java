package tech.regionguard.failover.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Progress of a multi-step business workflow, as tracked across cutovers.
 *
 * @param lastCompletedStepIndex index of the last committed step, -1 before the first commit
 * @param idempotencyToken       token of the pending step
 * @param note                   reason for manual reconciliation, if any
 */
@Schema(description = "In-flight workflow tracked across region cutovers")
public record WorkflowExecutionRecord(
    String workflowId,
    RegionId region,
    int lastCompletedStepIndex,
    String idempotencyToken,
    WorkflowStatus status,
    int resumeAttempts,
    Instant updatedAt,
    String note
) {

    public WorkflowExecutionRecord {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(status, "status");
    }

    public static WorkflowExecutionRecord started(String workflowId, RegionId region, Instant now) {
        return new WorkflowExecutionRecord(workflowId, region, -1, tokenFor(workflowId, 0),
            WorkflowStatus.IN_FLIGHT, 0, now, null);
    }

    /**
     * Deterministic token for a step, so a replayed step always carries the same token.
     */
    public static String tokenFor(String workflowId, int stepIndex) {
        return UUID.nameUUIDFromBytes((workflowId + "#" + stepIndex).getBytes(StandardCharsets.UTF_8)).toString();
    }

    @JsonIgnore
    public int pendingStepIndex() {
        return lastCompletedStepIndex + 1;
    }

    public WorkflowExecutionRecord committed(int stepIndex, Instant now) {
        int last = Math.max(lastCompletedStepIndex, stepIndex);
        return new WorkflowExecutionRecord(workflowId, region, last, tokenFor(workflowId, last + 1),
            WorkflowStatus.IN_FLIGHT, 0, now, null);
    }

    public WorkflowExecutionRecord retried(Instant now) {
        return new WorkflowExecutionRecord(workflowId, region, lastCompletedStepIndex, idempotencyToken,
            WorkflowStatus.IN_FLIGHT, resumeAttempts + 1, now, null);
    }

    public WorkflowExecutionRecord movedTo(RegionId newRegion, Instant now) {
        return new WorkflowExecutionRecord(workflowId, newRegion, lastCompletedStepIndex, idempotencyToken,
            status, resumeAttempts, now, note);
    }

    public WorkflowExecutionRecord withStatus(WorkflowStatus newStatus, String newNote, Instant now) {
        return new WorkflowExecutionRecord(workflowId, region, lastCompletedStepIndex, idempotencyToken,
            newStatus, resumeAttempts, now, newNote);
    }
}
