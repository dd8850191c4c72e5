package tech.regionguard.failover.endpoint;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Error returned by failover endpoints")
public record ErrorResponse(
    @Schema(description = "Machine readable error code", example = "PLAN_IN_PROGRESS")
    String code,
    @Schema(description = "Human readable message")
    String message
) {
}
