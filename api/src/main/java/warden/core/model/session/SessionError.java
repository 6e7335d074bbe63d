package warden.core.model.session;

public enum SessionError {
    NOT_FOUND,
    EXPIRED
}
