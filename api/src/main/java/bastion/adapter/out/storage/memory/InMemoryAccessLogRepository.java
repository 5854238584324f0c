package bastion.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import bastion.core.model.lockout.AccessLogEntry;
import bastion.spi.AccessLogRepository;

/**
 * In-memory implementation of AccessLogRepository.
 *
 * <p>Entries are kept in insertion order. For development and testing only.
 */
public class InMemoryAccessLogRepository implements AccessLogRepository {

    private final List<AccessLogEntry> entries = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Uni<AccessLogEntry> append(AccessLogEntry entry) {
        return Uni.createFrom().item(() -> {
            final var stored = entry.withId(sequence.incrementAndGet());
            synchronized (entries) {
                entries.add(stored);
            }
            return stored;
        });
    }

    @Override
    public Uni<Optional<AccessLogEntry>> closeLatest(String username, String ipAddress, Instant logoutTime) {
        return Uni.createFrom().item(() -> {
            synchronized (entries) {
                for (var i = entries.size() - 1; i >= 0; i--) {
                    final var entry = entries.get(i);
                    if (entry.open() && username.equals(entry.username()) && ipAddress.equals(entry.ipAddress())) {
                        final var closed = entry.withLogoutTime(logoutTime);
                        entries.set(i, closed);
                        return Optional.of(closed);
                    }
                }
                return Optional.<AccessLogEntry>empty();
            }
        });
    }

    @Override
    public Multi<AccessLogEntry> streamRecent(int limit) {
        return Multi.createFrom().items(() -> {
            final List<AccessLogEntry> snapshot;
            synchronized (entries) {
                snapshot = new ArrayList<>(entries);
            }
            final var newestFirst = new ArrayList<AccessLogEntry>(snapshot.size());
            for (var i = snapshot.size() - 1; i >= 0 && newestFirst.size() < limit; i--) {
                newestFirst.add(snapshot.get(i));
            }
            return newestFirst.stream();
        });
    }

    /**
     * Clears all data. For testing purposes only.
     */
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}
