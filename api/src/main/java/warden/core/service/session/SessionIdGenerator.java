package warden.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Session identifiers: 256 random bits as unpadded URL-safe Base64 (43 characters).
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int ID_BYTES = 32;
    private static final Pattern ID_SHAPE = Pattern.compile("[A-Za-z0-9_-]{43}");

    private final SecureRandom random;
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();

    public SessionIdGenerator() {
        this(new SecureRandom());
    }

    SessionIdGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        final var bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }

    /**
     * Whether {@code value} could have come from {@link #generate()}. Anything else
     * cannot name a stored session.
     */
    public boolean isWellFormed(String value) {
        return value != null && ID_SHAPE.matcher(value).matches();
    }
}
