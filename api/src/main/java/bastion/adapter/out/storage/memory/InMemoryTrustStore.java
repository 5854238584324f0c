package bastion.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import bastion.core.model.lockout.TrustRecord;
import bastion.spi.TrustStore;

/**
 * In-memory implementation of TrustStore.
 *
 * <p>For development and testing only; trust records are lost on restart.
 */
public class InMemoryTrustStore implements TrustStore {

    private final ConcurrentMap<Pair, TrustRecord> records = new ConcurrentHashMap<>();

    @Override
    public Uni<TrustRecord> markTrusted(String username, String ipAddress, Instant at) {
        return Uni.createFrom()
                .item(() -> records.compute(
                        new Pair(username, ipAddress),
                        (k, existing) ->
                                existing == null ? TrustRecord.first(username, ipAddress, at) : existing.withLogout(at)));
    }

    @Override
    public Uni<Optional<TrustRecord>> find(String username, String ipAddress) {
        return Uni.createFrom().item(() -> Optional.ofNullable(records.get(new Pair(username, ipAddress))));
    }

    @Override
    public Uni<Integer> revoke(String username, String ipAddress) {
        return Uni.createFrom().item(() -> {
            var removed = 0;
            for (var pair : records.keySet()) {
                final var userMatches = username == null || username.equals(pair.username());
                final var ipMatches = ipAddress == null || ipAddress.equals(pair.ipAddress());
                if (userMatches && ipMatches && records.remove(pair) != null) {
                    removed++;
                }
            }
            return removed;
        });
    }

    /**
     * Clears all data. For testing purposes only.
     */
    public void clear() {
        records.clear();
    }

    private record Pair(String username, String ipAddress) {}
}
