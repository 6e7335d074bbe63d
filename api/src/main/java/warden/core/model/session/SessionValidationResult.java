package warden.core.model.session;

/**
 * Outcome of looking up a session by its refresh token.
 */
public sealed interface SessionValidationResult {

    record Valid(Session session) implements SessionValidationResult {}

    record Invalid(SessionError error) implements SessionValidationResult {}

    static SessionValidationResult valid(Session session) {
        return new Valid(session);
    }

    static SessionValidationResult notFound() {
        return new Invalid(SessionError.NOT_FOUND);
    }

    static SessionValidationResult expired() {
        return new Invalid(SessionError.EXPIRED);
    }
}
