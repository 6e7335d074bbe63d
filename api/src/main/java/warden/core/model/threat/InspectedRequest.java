package warden.core.model.threat;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The parts of an inbound request the threat monitor looks at.
 *
 * @param sourceIp client address
 * @param method   HTTP method
 * @param path     request path
 * @param query    raw query string, may be empty
 * @param headers  header values by name
 */
public record InspectedRequest(
        String sourceIp, String method, String path, String query, Map<String, List<String>> headers) {

    // Free-text headers a client fills in. Protocol headers such as
    // Access-Control-Request-Method legitimately carry SQL verbs like DELETE.
    private static final Set<String> INSPECTED_HEADERS = Set.of("user-agent", "referer");

    public InspectedRequest {
        sourceIp = sourceIp == null || sourceIp.isBlank() ? "unknown" : sourceIp;
        path = path == null ? "" : path;
        query = query == null ? "" : query;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static InspectedRequest of(String sourceIp, String method, String path, String query) {
        return new InspectedRequest(sourceIp, method, path, query, Map.of());
    }

    /**
     * Path and query in raw and URL-decoded form, followed by the values of the
     * free-text headers {@code User-Agent} and {@code Referer}.
     */
    public List<String> inspectableValues() {
        final var values = new ArrayList<String>();
        addWithDecoded(values, path);
        addWithDecoded(values, query);
        headers.forEach((name, list) -> {
            if (INSPECTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                values.addAll(list);
            }
        });
        return values;
    }

    private static void addWithDecoded(List<String> values, String raw) {
        if (raw.isEmpty()) {
            return;
        }
        values.add(raw);
        try {
            final var decoded = URLDecoder.decode(raw, StandardCharsets.UTF_8);
            if (!decoded.equals(raw)) {
                values.add(decoded);
            }
        } catch (IllegalArgumentException e) {
            // Malformed escapes: the raw value is still inspected.
            values.add(raw.replace('+', ' '));
        }
    }
}
