package tech.regionguard.failover.warning;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * An operator-visible warning.
 */
@Schema(description = "Operator-visible warning raised by the orchestrator")
public record Warning(
    @Schema(description = "Unique warning identifier (UUID)", examples = {"550e8400-e29b-41d4-a716-446655440000"})
    String id,

    @Schema(description = "Warning category",
            examples = {"MODE_CHANGE", "NO_SAFE_TARGET", "CUTOVER", "WORKFLOW", "LEASE"})
    String category,

    @Schema(description = "Severity level", examples = {"CRITICAL", "WARNING", "INFO"})
    String severity,

    @Schema(description = "Warning message describing the issue",
            examples = {"Primary UNHEALTHY but no safe failover target: secondary DEGRADED, lag 2000ms"})
    String message,

    @Schema(description = "Timestamp when warning was created", examples = {"2026-03-02T10:52:20Z"})
    Instant timestamp,

    @Schema(description = "Source component that generated the warning",
            examples = {"FailoverDecisionEngine", "CutoverCoordinator", "LeadershipService"})
    String source,

    @Schema(description = "Whether the warning has been acknowledged", examples = {"false", "true"})
    boolean acknowledged
) {}
