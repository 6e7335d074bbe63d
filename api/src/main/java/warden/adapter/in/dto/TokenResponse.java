package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import warden.core.model.auth.TokenPair;

/**
 * DTO for issued credentials.
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("session_id") String sessionId) {

    public static TokenResponse from(TokenPair tokens) {
        return new TokenResponse(
                tokens.accessToken(),
                tokens.refreshToken(),
                tokens.tokenType(),
                tokens.expiresInSeconds(),
                tokens.sessionId());
    }
}
