package warden.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digests of secrets that must be identifiable but never stored or logged.
 *
 * <p>Refresh tokens are persisted only as their full digest; tokens and client
 * addresses appear in logs only as a truncated digest.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final int LOG_HEX_CHARS = 12;

    private SecureHash() {}

    /**
     * Full lowercase hex SHA-256 digest.
     */
    public static String sha256(String input) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 is required on every Java platform", e);
        }
    }

    /**
     * First {@code hexChars} characters of the hex digest.
     *
     * @throws IllegalArgumentException if hexChars is outside 1..64
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        return sha256(input).substring(0, hexChars);
    }

    /**
     * Short digest for log lines.
     */
    public static String forLog(String secret) {
        return secret == null ? "<none>" : truncatedSha256(secret, LOG_HEX_CHARS);
    }
}
