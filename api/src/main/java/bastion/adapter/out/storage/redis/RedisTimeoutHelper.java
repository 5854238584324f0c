package bastion.adapter.out.storage.redis;

import java.time.Duration;

import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.spi.StoreUnavailableException;

/**
 * Helper for applying timeouts and failure translation to Redis operations.
 *
 * <p>Lockout stores must not hang a login request on a slow or absent Redis. Every
 * operation is bounded by the configured timeout, and both timeouts and connection
 * failures surface as {@link StoreUnavailableException} so the attempt recorder can
 * apply its fail-open setting.
 *
 * <h2>Metrics</h2>
 * Records separate counters for timeouts ({@code bastion.redis.timeouts.total}) and
 * non-timeout failures ({@code bastion.redis.failures.total}), tagged by repository
 * and operation.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final MeterRegistry meterRegistry;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param meterRegistry registry for failure counters (may be null)
     * @param repositoryName the repository name for logging and metric tags
     */
    public RedisTimeoutHelper(Duration timeout, MeterRegistry meterRegistry, String repositoryName) {
        this.timeout = timeout;
        this.meterRegistry = meterRegistry;
        this.repositoryName = repositoryName;
    }

    /**
     * Bound a single-valued operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with StoreUnavailableException on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> timedOut(operationName))
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> failed(operationName, error));
    }

    /**
     * Bound a streaming operation. The timeout applies to each item, not the whole stream.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the item type
     * @return a Multi that fails with StoreUnavailableException on timeout or failure
     */
    public <T> Multi<T> withTimeout(Multi<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> timedOut(operationName))
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> failed(operationName, error));
    }

    private StoreUnavailableException timedOut(String operationName) {
        LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
        increment("bastion.redis.timeouts.total", operationName);
        return new StoreUnavailableException(
                "Redis operation timeout: " + operationName + " in " + repositoryName, new TimeoutException());
    }

    private StoreUnavailableException failed(String operationName, Throwable error) {
        LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, error.getMessage());
        increment("bastion.redis.failures.total", operationName);
        return new StoreUnavailableException(
                "Redis operation failed: " + operationName + " in " + repositoryName, error);
    }

    private void increment(String meterName, String operationName) {
        if (meterRegistry != null) {
            meterRegistry
                    .counter(meterName, "repository", repositoryName, "operation", operationName)
                    .increment();
        }
    }
}
