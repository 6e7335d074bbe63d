package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for placing a manual block.
 *
 * @param kind            {@code ip} or {@code principal}
 * @param value           address or principal id
 * @param reason          why the block is placed
 * @param durationSeconds block length; the configured block duration when absent
 */
public record BlockRequest(
        String kind, String value, String reason, @JsonProperty("duration_seconds") Long durationSeconds) {}
