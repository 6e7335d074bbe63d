package warden.core.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import warden.core.model.auth.PrincipalKind;
import warden.core.model.principal.PrincipalStatus;

/**
 * Seed entries for the built-in in-memory principal directory.
 *
 * <p>Configuration prefix: {@code warden.directory}
 */
@ConfigMapping(prefix = "warden.directory")
public interface DirectoryConfig {

    /**
     * Principals keyed by id.
     */
    Map<String, SeedPrincipal> users();

    interface SeedPrincipal {

        /**
         * Login email; API keys have none.
         */
        Optional<String> email();

        /**
         * Bcrypt hash of the password.
         */
        Optional<String> passwordHash();

        @WithDefault("free")
        String role();

        @WithDefault("user")
        PrincipalKind kind();

        @WithDefault("active")
        PrincipalStatus status();
    }
}
