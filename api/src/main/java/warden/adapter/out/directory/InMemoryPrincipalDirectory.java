package warden.adapter.out.directory;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.DirectoryConfig;
import warden.core.model.auth.PrincipalKind;
import warden.core.model.principal.Principal;
import warden.spi.PrincipalDirectory;

/**
 * In-memory principal directory seeded from {@code warden.directory.users}.
 *
 * <p>This is the fallback used when no other {@link PrincipalDirectory} bean is
 * present. Platform teams connect their user store via CDI:
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class UserServiceDirectory implements PrincipalDirectory {
 *     // Custom implementation
 * }
 * }</pre>
 */
@ApplicationScoped
@DefaultBean
public class InMemoryPrincipalDirectory implements PrincipalDirectory {

    private static final Logger LOG = Logger.getLogger(InMemoryPrincipalDirectory.class);

    private final ConcurrentMap<String, Principal> principalsById = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idsByEmail = new ConcurrentHashMap<>();

    public InMemoryPrincipalDirectory() {}

    @Inject
    public InMemoryPrincipalDirectory(DirectoryConfig config) {
        config.users().forEach((id, seed) -> register(
                new Principal(id, seed.kind(), seed.role(), seed.status(), seed.passwordHash().orElse(null)),
                seed.email().orElse(null)));
        LOG.infof("Initialized in-memory principal directory with %d principal(s)", principalsById.size());
    }

    /**
     * Add or replace a principal.
     *
     * @param email login email, or null for principals that cannot log in
     */
    public void register(Principal principal, String email) {
        principalsById.put(principal.id(), principal);
        if (email != null && principal.kind() == PrincipalKind.USER) {
            idsByEmail.put(normalize(email), principal.id());
        }
    }

    @Override
    public Uni<Optional<Principal>> getPrincipalById(String principalId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(principalsById.get(principalId)));
    }

    @Override
    public Uni<Optional<Principal>> getPrincipalByEmail(String email) {
        return Uni.createFrom().item(() -> Optional.ofNullable(email)
                .map(InMemoryPrincipalDirectory::normalize)
                .map(idsByEmail::get)
                .map(principalsById::get)
                .filter(principal -> principal.kind() == PrincipalKind.USER));
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
