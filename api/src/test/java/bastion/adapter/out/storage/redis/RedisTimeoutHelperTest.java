package bastion.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import bastion.spi.StoreUnavailableException;

@DisplayName("RedisTimeoutHelper")
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String REPOSITORY_NAME = "attempts";
    private static final String OPERATION_NAME = "find";

    private SimpleMeterRegistry registry;
    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        helper = new RedisTimeoutHelper(TIMEOUT, registry, REPOSITORY_NAME);
    }

    private double count(String meterName) {
        final var counter = registry.find(meterName)
                .tag("repository", REPOSITORY_NAME)
                .tag("operation", OPERATION_NAME)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("withTimeout(Uni)")
    class UniTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResult() {
            final var result = helper.withTimeout(Uni.createFrom().item("ok"), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertEquals("ok", result);
            assertEquals(0, count("bastion.redis.timeouts.total"));
        }

        @Test
        @DisplayName("should fail with StoreUnavailableException on timeout")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    StoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertTrue(exception.getMessage().contains(OPERATION_NAME));
            assertTrue(exception.getMessage().contains(REPOSITORY_NAME));
            assertEquals(1, count("bastion.redis.timeouts.total"));
            assertEquals(0, count("bastion.redis.failures.total"));
        }

        @Test
        @DisplayName("should wrap connection failures")
        void shouldWrapFailures() {
            final var operation = Uni.createFrom().<String>failure(new ConnectException("Connection refused"));

            final var exception = assertThrows(
                    StoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertInstanceOf(ConnectException.class, exception.getCause());
            assertEquals(1, count("bastion.redis.failures.total"));
        }

        @Test
        @DisplayName("should work without a meter registry")
        void shouldWorkWithoutRegistry() {
            final var noMetrics = new RedisTimeoutHelper(TIMEOUT, null, REPOSITORY_NAME);
            final var operation = Uni.createFrom().<String>failure(new IllegalStateException("closed"));

            assertThrows(
                    StoreUnavailableException.class,
                    () -> noMetrics.withTimeout(operation, OPERATION_NAME).await().indefinitely());
        }

        @Test
        @DisplayName("should pass null items through")
        void shouldPassNull() {
            assertNull(helper.withTimeout(Uni.createFrom().<String>nullItem(), OPERATION_NAME)
                    .await()
                    .indefinitely());
        }
    }

    @Nested
    @DisplayName("withTimeout(Multi)")
    class MultiTests {

        @Test
        @DisplayName("should stream items")
        void shouldStreamItems() {
            final var items = helper.withTimeout(Multi.createFrom().items("a", "b"), OPERATION_NAME)
                    .collect()
                    .asList()
                    .await()
                    .indefinitely();

            assertEquals(List.of("a", "b"), items);
        }

        @Test
        @DisplayName("should fail a stalled stream")
        void shouldFailStalledStream() {
            final var operation = Multi.createFrom().<String>nothing();

            assertThrows(
                    StoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME)
                            .collect()
                            .asList()
                            .await()
                            .indefinitely());
        }
    }
}
