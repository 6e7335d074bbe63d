package warden.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    private static final String ABC_DIGEST = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    @DisplayName("should produce the full lowercase hex digest")
    void shouldProduceFullDigest() {
        assertEquals(ABC_DIGEST, SecureHash.sha256("abc"));
    }

    @Test
    @DisplayName("should truncate to the requested prefix")
    void shouldTruncate() {
        assertEquals(ABC_DIGEST.substring(0, 16), SecureHash.truncatedSha256("abc", 16));
        assertEquals(ABC_DIGEST, SecureHash.truncatedSha256("abc", 64));
    }

    @Test
    @DisplayName("should reject lengths outside 1..64")
    void shouldRejectBadLength() {
        assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("abc", 0));
        assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("abc", 65));
    }

    @Test
    @DisplayName("should shorten secrets for log lines")
    void shouldShortenForLog() {
        assertEquals(ABC_DIGEST.substring(0, 12), SecureHash.forLog("abc"));
        assertEquals("<none>", SecureHash.forLog(null));
        assertTrue(SecureHash.forLog("refresh-token").matches("^[0-9a-f]{12}$"));
    }
}
