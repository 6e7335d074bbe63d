package warden.core.model.threat;

public enum ThreatError {
    PATTERN_MATCHED,
    VOLUME_EXCEEDED,
    SOURCE_BLOCKED
}
