package bastion.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.runtime.datasource.ReactiveRedisDataSourceImpl;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.redis.client.RedisOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import bastion.core.model.lockout.ScopeKey;
import bastion.core.model.lockout.ScopeType;

/**
 * Integration tests for the Redis attempt store's increment script using a real Redis instance
 * via testcontainers.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Redis Attempt Store Integration")
class RedisAttemptStoreIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");
    private static final Duration COOLOFF = Duration.ofHours(1);
    private static final Duration WAIT = Duration.ofSeconds(5);

    @Container
    static GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static Vertx vertx;
    private static Redis redisClient;
    private static ReactiveRedisDataSource dataSource;

    private RedisAttemptStore store;

    @BeforeAll
    static void setUpClient() {
        vertx = Vertx.vertx();
        final var connection = "redis://" + redis.getHost() + ":" + redis.getMappedPort(6379);
        redisClient = Redis.createClient(vertx, new RedisOptions().setConnectionString(connection));
        dataSource = new ReactiveRedisDataSourceImpl(vertx, redisClient, RedisAPI.api(redisClient));
    }

    @AfterAll
    static void tearDownClient() {
        if (redisClient != null) {
            redisClient.close();
        }
        if (vertx != null) {
            vertx.closeAndAwait();
        }
    }

    @BeforeEach
    void setUp() {
        dataSource.flushall().await().atMost(WAIT);
        store = new RedisAttemptStore(dataSource, new RedisTimeoutHelper(WAIT, null, "attempts"));
    }

    private int failAt(ScopeKey scope, String ip, Instant at, Duration cooloff) {
        return store.recordFailure(scope, ip, "agent", at, cooloff).await().atMost(WAIT).failureCount();
    }

    @Nested
    @DisplayName("recordFailure()")
    class RecordFailureTests {

        @Test
        @DisplayName("should accumulate failures and keep the first failure time")
        void shouldAccumulate() {
            final var scope = ScopeKey.ip("10.0.0.1", null);
            failAt(scope, "10.0.0.1", T0, COOLOFF);
            failAt(scope, "10.0.0.1", T0.plusSeconds(10), COOLOFF);

            final var record = store.find(scope.value()).await().atMost(WAIT).orElseThrow();

            assertEquals(2, record.failureCount());
            assertEquals(ScopeType.IP, record.scope());
            assertEquals("10.0.0.1", record.ipAddress());
            assertNull(record.username());
            assertEquals(T0, record.firstFailureAt());
            assertEquals(T0.plusSeconds(10), record.lastFailureAt());
        }

        @Test
        @DisplayName("should restart a run older than the cool-off window")
        void shouldRestartStaleRun() {
            final var scope = ScopeKey.username("bob");
            failAt(scope, "10.0.0.1", T0, COOLOFF);
            failAt(scope, "10.0.0.1", T0.plusSeconds(1), COOLOFF);

            assertEquals(1, failAt(scope, "10.0.0.1", T0.plus(COOLOFF).plusSeconds(2), COOLOFF));
        }

        @Test
        @DisplayName("should never restart with a zero cool-off")
        void shouldNeverRestartWithoutCooloff() {
            final var scope = ScopeKey.username("bob");
            failAt(scope, "10.0.0.1", T0, Duration.ZERO);

            assertEquals(2, failAt(scope, "10.0.0.1", T0.plus(Duration.ofDays(30)), Duration.ZERO));
        }

        @Test
        @DisplayName("should not lose concurrent increments")
        void shouldIncrementAtomically() throws InterruptedException {
            final var scope = ScopeKey.username("bob");
            final var threads = 8;
            final var perThread = 10;
            final var done = new CountDownLatch(threads);
            final var executor = Executors.newFixedThreadPool(threads);
            try {
                for (var t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        try {
                            for (var i = 0; i < perThread; i++) {
                                failAt(scope, "10.0.0.1", T0, COOLOFF);
                            }
                        } finally {
                            done.countDown();
                        }
                    });
                }
                assertTrue(done.await(30, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(threads * perThread, store.find(scope.value()).await().atMost(WAIT).orElseThrow().failureCount());
        }
    }

    @Nested
    @DisplayName("clear operations")
    class ClearTests {

        @Test
        @DisplayName("should clear username scopes by the IP of their latest failure")
        void shouldClearByLatestIp() {
            failAt(ScopeKey.ip("10.0.0.1", null), "10.0.0.1", T0, COOLOFF);
            failAt(ScopeKey.username("bob"), "10.0.0.1", T0, COOLOFF);
            failAt(ScopeKey.username("alice"), "10.0.0.1", T0, COOLOFF);
            failAt(ScopeKey.username("alice"), "10.0.0.2", T0.plusSeconds(1), COOLOFF);

            assertEquals(2, store.clearByIp("10.0.0.1").await().atMost(WAIT));
            assertFalse(store.find("user:bob").await().atMost(WAIT).isPresent());
            assertTrue(store.find("user:alice").await().atMost(WAIT).isPresent());
        }

        @Test
        @DisplayName("should clear everything")
        void shouldClearAll() {
            failAt(ScopeKey.ip("10.0.0.1", null), "10.0.0.1", T0, COOLOFF);
            failAt(ScopeKey.username("bob"), "10.0.0.1", T0, COOLOFF);

            assertEquals(2, store.clearAll().await().atMost(WAIT));
            assertEquals(0, store.streamAll().collect().asList().await().atMost(WAIT).size());
        }
    }
}
