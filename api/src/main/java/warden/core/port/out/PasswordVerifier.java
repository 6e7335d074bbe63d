package warden.core.port.out;

/**
 * Port for checking a plaintext password against a stored hash.
 */
public interface PasswordVerifier {

    /**
     * @return true if the password matches; false for a null or unreadable hash
     */
    boolean matches(String password, String passwordHash);
}
