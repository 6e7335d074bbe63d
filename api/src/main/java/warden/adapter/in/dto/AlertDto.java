package warden.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.threat.SecurityAlert;

/**
 * Wire form of a {@link SecurityAlert}.
 */
public record AlertDto(
        String id,
        String severity,
        String category,
        String status,
        String source,
        String target,
        String description,
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("detected_at") Instant detectedAt,
        @JsonProperty("acknowledged_at") Instant acknowledgedAt,
        @JsonProperty("resolved_at") Instant resolvedAt,
        String assignee,
        @JsonProperty("resolution_notes") String resolutionNotes) {

    public static AlertDto from(SecurityAlert alert) {
        return new AlertDto(
                alert.id(),
                alert.severity().wireName(),
                alert.category().wireName(),
                alert.status().wireName(),
                alert.source(),
                alert.target(),
                alert.description(),
                alert.riskScore(),
                alert.detectedAt(),
                alert.acknowledgedAt(),
                alert.resolvedAt(),
                alert.assignee(),
                alert.resolutionNotes());
    }
}
