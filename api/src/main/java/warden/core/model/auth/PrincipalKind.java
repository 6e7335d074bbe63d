package warden.core.model.auth;

/**
 * Kind of authenticable identity a token was issued to.
 */
public enum PrincipalKind {
    USER("user"),
    API_KEY("api_key");

    private final String claimValue;

    PrincipalKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static PrincipalKind fromClaim(String value) {
        for (var kind : values()) {
            if (kind.claimValue.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown principal kind: " + value);
    }
}
