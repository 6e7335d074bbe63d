package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO carrying a refresh token, used by refresh and logout.
 */
public record RefreshTokenRequest(@JsonProperty("refresh_token") String refreshToken) {}
