package bastion.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.lockout.AttemptRecord;
import bastion.core.model.lockout.ScopeKey;
import bastion.spi.AttemptStore;

/**
 * In-memory implementation of AttemptStore.
 *
 * <p>
 * This implementation is intended for development and testing only.
 * Attempt records are lost on restart and not shared across instances.
 * Stale records are never swept; they are restarted on the next failure
 * and ignored by the evaluator until then.
 *
 * <p>
 * <strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryAttemptStore implements AttemptStore {

    private static final Logger LOG = Logger.getLogger(InMemoryAttemptStore.class);

    private final ConcurrentMap<String, AttemptRecord> records = new ConcurrentHashMap<>();

    public InMemoryAttemptStore() {
        LOG.info("Initialized in-memory attempt store");
    }

    @Override
    public Uni<Optional<AttemptRecord>> find(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(key)));
    }

    @Override
    public Uni<AttemptRecord> recordFailure(
            ScopeKey scope, String ipAddress, String userAgent, Instant at, Duration cooloff) {
        return Uni.createFrom().item(() -> {
            final var record = records.compute(scope.value(), (k, existing) -> {
                if (existing == null || isStale(existing, at, cooloff)) {
                    return AttemptRecord.first(scope, ipAddress, at, userAgent);
                }
                return existing.withFailure(ipAddress, at, userAgent);
            });
            LOG.debugf("Recorded failed attempt for %s: count=%d", scope, record.failureCount());
            return record;
        });
    }

    @Override
    public Uni<Boolean> clear(String key) {
        return Uni.createFrom().item(() -> records.remove(key) != null);
    }

    @Override
    public Uni<Integer> clearByIp(String ipAddress) {
        return Uni.createFrom().item(() -> removeMatching(record -> ipAddress.equals(record.ipAddress())));
    }

    @Override
    public Uni<Integer> clearByUsername(String username) {
        return Uni.createFrom().item(() -> removeMatching(record -> username.equals(record.username())));
    }

    @Override
    public Uni<Integer> clearAll() {
        return Uni.createFrom().item(() -> removeMatching(record -> true));
    }

    @Override
    public Multi<AttemptRecord> streamAll() {
        return Multi.createFrom().items(() -> List.copyOf(records.values()).stream());
    }

    /**
     * Clears all data. For testing purposes only.
     */
    public void clear() {
        records.clear();
    }

    private int removeMatching(Predicate<AttemptRecord> filter) {
        var removed = 0;
        for (var entry : records.entrySet()) {
            if (filter.test(entry.getValue()) && records.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private static boolean isStale(AttemptRecord record, Instant at, Duration cooloff) {
        return !cooloff.isZero() && Duration.between(record.lastFailureAt(), at).compareTo(cooloff) > 0;
    }
}
