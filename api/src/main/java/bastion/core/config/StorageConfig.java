package bastion.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the lockout storage backend.
 *
 * <p>Configuration prefix: {@code bastion.storage}
 */
@ConfigMapping(prefix = "bastion.storage")
public interface StorageConfig {

    /**
     * Which backend holds attempt records, trust records and the access log.
     *
     * <p>{@code memory} keeps everything in the JVM and is meant for development and tests.
     *
     * @return backend (default: redis)
     */
    @WithDefault("redis")
    Backend backend();

    /**
     * Redis settings.
     */
    RedisConfig redis();

    enum Backend {
        MEMORY,
        REDIS
    }

    interface RedisConfig {

        /**
         * Maximum time to wait for a single Redis operation.
         *
         * <p>If exceeded, the operation fails with a store-unavailable error and the
         * fail-open setting decides the verdict.
         *
         * @return operation timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration timeout();
    }
}
