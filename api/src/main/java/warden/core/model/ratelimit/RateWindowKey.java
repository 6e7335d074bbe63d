package warden.core.model.ratelimit;

/**
 * Identity of one window counter.
 *
 * <p>Cache key format: {@code ratelimit:{resource}:{window}:{bucket}:{identifier}}.
 * The identifier goes last since it may contain colons.
 */
public record RateWindowKey(String identifier, String resource, WindowKind window, long bucket) {

    public String toCacheKey() {
        return "ratelimit:" + resource + ":" + window.wireName() + ":" + bucket + ":" + identifier;
    }
}
