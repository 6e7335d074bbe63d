package warden.adapter.out.directory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import warden.core.model.auth.PrincipalKind;
import warden.core.model.principal.Principal;
import warden.core.model.principal.PrincipalStatus;

@DisplayName("InMemoryPrincipalDirectory")
class InMemoryPrincipalDirectoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private InMemoryPrincipalDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new InMemoryPrincipalDirectory();
        directory.register(
                new Principal("alice", PrincipalKind.USER, "professional", PrincipalStatus.ACTIVE, "hash"),
                "Alice@Example.com");
        directory.register(
                new Principal("ci-bot", PrincipalKind.API_KEY, "starter", PrincipalStatus.ACTIVE, null),
                "bot@example.com");
    }

    @Test
    @DisplayName("should find users by normalized email")
    void shouldFindByEmail() {
        final var found = directory.getPrincipalByEmail("  alice@example.COM ").await().atMost(TIMEOUT);

        assertEquals("alice", found.orElseThrow().id());
    }

    @Test
    @DisplayName("should not let API key principals log in by email")
    void shouldIgnoreApiKeyEmail() {
        assertTrue(directory.getPrincipalByEmail("bot@example.com").await().atMost(TIMEOUT).isEmpty());
        assertTrue(directory.getPrincipalById("ci-bot").await().atMost(TIMEOUT).isPresent());
    }

    @Test
    @DisplayName("should return empty for unknown principals")
    void shouldReturnEmptyForUnknown() {
        assertTrue(directory.getPrincipalById("nobody").await().atMost(TIMEOUT).isEmpty());
        assertTrue(directory.getPrincipalByEmail(null).await().atMost(TIMEOUT).isEmpty());
    }
}
