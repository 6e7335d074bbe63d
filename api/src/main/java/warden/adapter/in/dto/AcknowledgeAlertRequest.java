package warden.adapter.in.dto;

/**
 * DTO for acknowledging an alert.
 *
 * @param assignee operator taking the alert; defaults to the caller
 */
public record AcknowledgeAlertRequest(String assignee) {}
