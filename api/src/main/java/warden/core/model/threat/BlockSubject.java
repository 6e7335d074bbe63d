package warden.core.model.threat;

/**
 * Something that can be blocked: a source address or a principal.
 */
public record BlockSubject(Kind kind, String value) {

    public enum Kind {
        IP,
        PRINCIPAL
    }

    public static BlockSubject ip(String address) {
        return new BlockSubject(Kind.IP, address);
    }

    public static BlockSubject principal(String principalId) {
        return new BlockSubject(Kind.PRINCIPAL, principalId);
    }

    /**
     * Parses the form produced by {@link #key()}.
     */
    public static BlockSubject parse(String key) {
        if (key.startsWith("ip:")) {
            return ip(key.substring(3));
        }
        if (key.startsWith("principal:")) {
            return principal(key.substring(10));
        }
        throw new IllegalArgumentException("Unknown block subject: " + key);
    }

    public String key() {
        return (kind == Kind.IP ? "ip:" : "principal:") + value;
    }
}
