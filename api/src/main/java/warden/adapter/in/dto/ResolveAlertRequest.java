package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for closing an alert.
 *
 * @param notes         resolution notes
 * @param falsePositive close as a false positive instead of resolved
 */
public record ResolveAlertRequest(String notes, @JsonProperty("false_positive") Boolean falsePositive) {}
