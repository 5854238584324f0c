package bastion.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryTrustStore")
class InMemoryTrustStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private InMemoryTrustStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTrustStore();
    }

    @Test
    @DisplayName("should create and update a trust record")
    void shouldCreateAndUpdate() {
        store.markTrusted("bob", "10.0.0.1", T0).await().indefinitely();
        final var updated = store.markTrusted("bob", "10.0.0.1", T0.plusSeconds(60)).await().indefinitely();

        assertEquals(T0, updated.firstTrustedAt());
        assertEquals(T0.plusSeconds(60), updated.lastLogoutAt());
        assertEquals(2, updated.logoutCount());
    }

    @Test
    @DisplayName("should revoke by username, by IP, or everything")
    void shouldRevoke() {
        store.markTrusted("bob", "10.0.0.1", T0).await().indefinitely();
        store.markTrusted("bob", "10.0.0.2", T0).await().indefinitely();
        store.markTrusted("alice", "10.0.0.1", T0).await().indefinitely();
        store.markTrusted("carol", "10.0.0.3", T0).await().indefinitely();

        assertEquals(1, store.revoke("bob", "10.0.0.2").await().indefinitely());
        assertEquals(2, store.revoke(null, "10.0.0.1").await().indefinitely());
        assertEquals(1, store.revoke(null, null).await().indefinitely());
        assertTrue(store.find("carol", "10.0.0.3").await().indefinitely().isEmpty());
    }
}
