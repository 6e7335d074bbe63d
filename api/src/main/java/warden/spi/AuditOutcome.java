package warden.spi;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
