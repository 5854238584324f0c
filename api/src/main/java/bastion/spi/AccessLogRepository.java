package bastion.spi;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import bastion.core.model.lockout.AccessLogEntry;

/**
 * SPI for the append-only login/logout audit trail.
 *
 * <p>Entries are created at login and mutated exactly once, at logout.
 * Deletion is an administrative concern outside this interface.
 */
public interface AccessLogRepository {

    /**
     * Append an entry and assign it an identifier.
     *
     * @param entry the entry (its id is ignored)
     * @return Uni with the stored entry carrying its new id
     */
    Uni<AccessLogEntry> append(AccessLogEntry entry);

    /**
     * Close the most recent open entry for a pair.
     *
     * @param username the username
     * @param ipAddress the client IP address
     * @param logoutTime the logout time
     * @return Uni with the closed entry, or empty if no open entry exists
     */
    Uni<Optional<AccessLogEntry>> closeLatest(String username, String ipAddress, Instant logoutTime);

    /**
     * Stream entries, newest first.
     *
     * @param limit maximum number of entries
     * @return Multi of entries
     */
    Multi<AccessLogEntry> streamRecent(int limit);
}
