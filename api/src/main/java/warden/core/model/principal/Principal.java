package warden.core.model.principal;

import warden.core.model.auth.PrincipalKind;

/**
 * Read-only view of a principal owned by the external principal store.
 *
 * @param id           principal identifier
 * @param kind         user or API key
 * @param role         role, or the rate-limit tier of an API key
 * @param status       account status
 * @param passwordHash bcrypt hash for users, null for API keys
 */
public record Principal(String id, PrincipalKind kind, String role, PrincipalStatus status, String passwordHash) {

    public boolean isActive() {
        return status == PrincipalStatus.ACTIVE;
    }
}
