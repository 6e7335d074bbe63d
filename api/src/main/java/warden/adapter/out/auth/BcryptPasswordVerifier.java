package warden.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.elytron.security.common.BcryptUtil;
import org.jboss.logging.Logger;

import warden.core.port.out.PasswordVerifier;

/**
 * Verifies passwords against Modular Crypt Format bcrypt hashes.
 */
@ApplicationScoped
public class BcryptPasswordVerifier implements PasswordVerifier {

    private static final Logger LOG = Logger.getLogger(BcryptPasswordVerifier.class);

    @Override
    public boolean matches(String password, String passwordHash) {
        if (password == null || passwordHash == null || passwordHash.isBlank()) {
            return false;
        }
        try {
            return BcryptUtil.matches(password, passwordHash);
        } catch (RuntimeException e) {
            LOG.warnf("Stored password hash is not a readable bcrypt hash: %s", e.getMessage());
            return false;
        }
    }
}
