package warden.core.model.threat;

public enum AlertError {
    NOT_FOUND,
    INVALID_TRANSITION
}
