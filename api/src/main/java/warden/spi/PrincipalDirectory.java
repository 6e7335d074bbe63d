package warden.spi;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.principal.Principal;

/**
 * Read access to the external principal store.
 *
 * <p>Deployments provide a CDI bean implementing this interface; the built-in
 * in-memory directory is used only when none is present.
 */
public interface PrincipalDirectory {

    Uni<Optional<Principal>> getPrincipalById(String principalId);

    /**
     * Look up a user by login email. API keys are never returned.
     */
    Uni<Optional<Principal>> getPrincipalByEmail(String email);
}
