package warden.core.model.auth;

/**
 * Credentials handed to a client after login or refresh.
 *
 * @param accessToken      signed access token
 * @param refreshToken     signed refresh token (unchanged on refresh)
 * @param expiresInSeconds access token lifetime
 * @param sessionId        id of the backing session
 */
public record TokenPair(String accessToken, String refreshToken, long expiresInSeconds, String sessionId) {

    public String tokenType() {
        return "bearer";
    }
}
