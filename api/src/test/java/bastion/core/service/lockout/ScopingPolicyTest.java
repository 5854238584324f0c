package bastion.core.service.lockout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bastion.core.model.lockout.LockoutPolicy;
import bastion.core.model.lockout.ScopeKey;
import bastion.core.model.lockout.ScopeType;

@DisplayName("ScopingPolicy")
class ScopingPolicyTest {

    private static List<String> values(List<ScopeKey> keys) {
        return keys.stream().map(ScopeKey::value).toList();
    }

    @Nested
    @DisplayName("Default mode")
    class DefaultModeTests {

        private final ScopingPolicy scoping = new ScopingPolicy(LockoutPolicy.builder().build());

        @Test
        @DisplayName("should scope by IP and by username")
        void shouldScopeByIpAndUsername() {
            final var keys = scoping.keysFor("bob", "10.0.0.1", "Mozilla/5.0");

            assertEquals(List.of("ip:10.0.0.1", "user:bob"), values(keys));
            assertEquals(ScopeType.IP, keys.get(0).type());
            assertEquals("10.0.0.1", keys.get(0).ipAddress());
            assertEquals("bob", keys.get(1).username());
        }

        @Test
        @DisplayName("should fall back to IP for a blank username")
        void shouldFallBackToIp() {
            assertEquals(List.of("ip:10.0.0.1"), values(scoping.keysFor("   ", "10.0.0.1", null)));
            assertEquals(List.of("ip:10.0.0.1"), values(scoping.keysFor(null, "10.0.0.1", null)));
        }

        @Test
        @DisplayName("should keep only the username scope without an IP")
        void shouldDropIpScopeWithoutIp() {
            assertEquals(List.of("user:bob"), values(scoping.keysFor("bob", null, null)));
        }

        @Test
        @DisplayName("should return no scope when both are blank")
        void shouldReturnNoScope() {
            assertTrue(scoping.keysFor("", " ", "agent").isEmpty());
        }

        @Test
        @DisplayName("should trim but not fold case")
        void shouldTrimOnly() {
            assertEquals(List.of("ip:10.0.0.1", "user:Bob"), values(scoping.keysFor(" Bob ", " 10.0.0.1", null)));
        }
    }

    @Nested
    @DisplayName("Combination mode")
    class CombinationModeTests {

        private final ScopingPolicy scoping =
                new ScopingPolicy(LockoutPolicy.builder().combinationUserAndIp(true).build());

        @Test
        @DisplayName("should use a single username+IP scope")
        void shouldUseCombinedScope() {
            final var keys = scoping.keysFor("bob", "10.0.0.1", null);

            assertEquals(1, keys.size());
            assertEquals(ScopeType.USERNAME_AND_IP, keys.get(0).type());
            assertEquals("userip:3:bob:10.0.0.1", keys.get(0).value());
        }

        @Test
        @DisplayName("should keep usernames containing separators apart")
        void shouldNotCollide() {
            final var first = scoping.keysFor("a:b", "c", null).get(0);
            final var second = scoping.keysFor("a", "b:c", null).get(0);

            assertNotEquals(first.value(), second.value());
        }

        @Test
        @DisplayName("should fall back to IP for a blank username")
        void shouldFallBackToIp() {
            assertEquals(List.of("ip:10.0.0.1"), values(scoping.keysFor("", "10.0.0.1", null)));
        }
    }

    @Nested
    @DisplayName("Only-user mode")
    class OnlyUserModeTests {

        private final ScopingPolicy scoping =
                new ScopingPolicy(LockoutPolicy.builder().onlyUserFailures(true).build());

        @Test
        @DisplayName("should scope by username only")
        void shouldScopeByUsername() {
            assertEquals(List.of("user:bob"), values(scoping.keysFor("bob", "10.0.0.1", null)));
        }

        @Test
        @DisplayName("should still fall back to IP for a blank username")
        void shouldFallBackToIp() {
            assertEquals(List.of("ip:10.0.0.1"), values(scoping.keysFor(null, "10.0.0.1", null)));
        }
    }

    @Nested
    @DisplayName("User agent scoping")
    class UserAgentTests {

        private final ScopingPolicy scoping = new ScopingPolicy(
                LockoutPolicy.builder().useUserAgent(true).userAgentMaxLength(255).build());

        @Test
        @DisplayName("should separate IP scopes by user agent")
        void shouldSeparateByUserAgent() {
            final var firefox = scoping.keysFor("bob", "10.0.0.1", "Firefox").get(0).value();
            final var chrome = scoping.keysFor("bob", "10.0.0.1", "Chrome").get(0).value();

            assertTrue(firefox.startsWith("ip:10.0.0.1|ua:"));
            assertNotEquals(firefox, chrome);
        }

        @Test
        @DisplayName("should not add the user agent to the username scope")
        void shouldNotTouchUsernameScope() {
            assertEquals("user:bob", scoping.keysFor("bob", "10.0.0.1", "Firefox").get(1).value());
        }

        @Test
        @DisplayName("should hash only the truncated user agent")
        void shouldHashTruncated() {
            final var longAgent = "ie6".repeat(1024);
            final var truncated = longAgent.substring(0, 255);

            assertEquals(
                    scoping.keysFor("bob", "10.0.0.1", longAgent).get(0).value(),
                    scoping.keysFor("bob", "10.0.0.1", truncated).get(0).value());
        }
    }
}
