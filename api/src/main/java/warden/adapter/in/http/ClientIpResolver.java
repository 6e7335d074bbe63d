package warden.adapter.in.http;

import java.util.Locale;

/**
 * Extracts the client address from forwarding headers.
 *
 * <p>RFC 7239 {@code Forwarded} is preferred, then the first
 * {@code X-Forwarded-For} entry, then the socket peer address.
 */
public final class ClientIpResolver {

    private ClientIpResolver() {}

    public static String resolve(String forwarded, String xForwardedFor, String remoteAddress) {
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null && !ip.isBlank()) {
                return ip;
            }
        }

        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        return remoteAddress != null && !remoteAddress.isBlank() ? remoteAddress : "unknown";
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is the one closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                continue;
            }
            var value = trimmed.substring(4);
            if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                value = value.substring(1, value.length() - 1);
            }
            if (value.startsWith("[")) {
                final var bracketEnd = value.indexOf(']');
                if (bracketEnd > 0) {
                    return value.substring(1, bracketEnd);
                }
            }
            // host:port only for IPv4; a bare IPv6 address has several colons
            final var colonCount = value.length() - value.replace(":", "").length();
            if (colonCount == 1) {
                value = value.substring(0, value.indexOf(':'));
            }
            return value;
        }
        return null;
    }
}
