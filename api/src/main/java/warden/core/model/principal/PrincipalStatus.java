package warden.core.model.principal;

/**
 * Account status as reported by the principal store.
 */
public enum PrincipalStatus {
    ACTIVE,
    PENDING_VERIFICATION,
    SUSPENDED
}
