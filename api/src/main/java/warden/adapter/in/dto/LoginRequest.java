package warden.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for login requests.
 *
 * @param email      login email (required)
 * @param password   plaintext password (required)
 * @param rememberMe request a 30-day refresh token instead of 7 days
 */
public record LoginRequest(String email, String password, @JsonProperty("remember_me") Boolean rememberMe) {}
