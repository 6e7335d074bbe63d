package warden.core.port.in;

import io.smallrye.mutiny.Uni;

import warden.core.model.auth.AuthenticationResult;
import warden.core.model.auth.ClientContext;

/**
 * Inbound port for the login, refresh and logout flows.
 */
public interface AuthenticationUseCase {

    /**
     * Authenticate with e-mail and password.
     *
     * <p>Unknown accounts and wrong passwords are both reported as
     * INVALID_CREDENTIALS.
     */
    Uni<AuthenticationResult> login(String email, String password, boolean rememberMe, ClientContext client);

    /**
     * Mint a new access token from a refresh token. The refresh token itself is
     * returned unchanged.
     */
    Uni<AuthenticationResult> refresh(String refreshToken);

    /**
     * End the session holding {@code refreshToken}. A later refresh with the same
     * token is rejected with SessionError NOT_FOUND.
     *
     * @return true if an active session was ended
     */
    Uni<Boolean> logout(String refreshToken);

    /**
     * End every session of a principal, e.g. after a password change.
     *
     * @return number of sessions ended
     */
    Uni<Integer> revokeAllSessions(String principalId);
}
