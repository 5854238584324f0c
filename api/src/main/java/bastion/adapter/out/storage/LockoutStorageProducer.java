package bastion.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.arc.DefaultBean;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import bastion.adapter.out.storage.memory.InMemoryAccessLogRepository;
import bastion.adapter.out.storage.memory.InMemoryAttemptStore;
import bastion.adapter.out.storage.memory.InMemoryTrustStore;
import bastion.adapter.out.storage.redis.RedisAccessLogRepository;
import bastion.adapter.out.storage.redis.RedisAttemptStore;
import bastion.adapter.out.storage.redis.RedisTimeoutHelper;
import bastion.adapter.out.storage.redis.RedisTrustStore;
import bastion.core.config.StorageConfig;
import bastion.spi.AccessLogRepository;
import bastion.spi.AttemptStore;
import bastion.spi.TrustStore;

/**
 * CDI producer for the lockout stores.
 *
 * <p>The backend is selected by {@code bastion.storage.backend}. The Redis data source is
 * resolved lazily so the memory backend never opens a Redis connection.
 *
 * <p>Platform teams can replace any store by declaring an {@code @Alternative} bean
 * implementing the corresponding SPI.
 *
 * @see bastion.spi.AttemptStore
 * @see bastion.spi.TrustStore
 * @see bastion.spi.AccessLogRepository
 */
@ApplicationScoped
public class LockoutStorageProducer {

    private static final Logger LOG = Logger.getLogger(LockoutStorageProducer.class);

    private final StorageConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<MeterRegistry> meterRegistry;

    @Inject
    public LockoutStorageProducer(
            StorageConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<MeterRegistry> meterRegistry) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.meterRegistry = meterRegistry;
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public AttemptStore attemptStore() {
        LOG.infof("Using %s attempt store", config.backend());
        if (config.backend() == StorageConfig.Backend.MEMORY) {
            return new InMemoryAttemptStore();
        }
        return new RedisAttemptStore(redisDataSource.get(), timeoutHelper("attempts"));
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public TrustStore trustStore() {
        if (config.backend() == StorageConfig.Backend.MEMORY) {
            return new InMemoryTrustStore();
        }
        return new RedisTrustStore(redisDataSource.get(), timeoutHelper("trust"));
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    public AccessLogRepository accessLogRepository() {
        if (config.backend() == StorageConfig.Backend.MEMORY) {
            return new InMemoryAccessLogRepository();
        }
        return new RedisAccessLogRepository(redisDataSource.get(), timeoutHelper("access-log"));
    }

    private RedisTimeoutHelper timeoutHelper(String repositoryName) {
        final var registry = meterRegistry.isResolvable() ? meterRegistry.get() : null;
        return new RedisTimeoutHelper(config.redis().timeout(), registry, repositoryName);
    }
}
