package bastion.spi;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import bastion.core.model.lockout.AttemptRecord;
import bastion.core.model.lockout.ScopeKey;

/**
 * SPI for storing failed login attempts per scope key.
 *
 * <p>Platform teams can provide custom implementations for their preferred
 * storage backend (e.g., a relational table, DynamoDB, Memcached).
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #recordFailure} MUST be atomic per key; concurrent failures must not lose updates</li>
 *   <li>Records MUST NOT carry a stored "locked" flag; lockout is derived at read time</li>
 *   <li>Implementations MUST NOT rely on a background sweeper for correctness</li>
 *   <li>Connection failures SHOULD surface as {@link StoreUnavailableException}</li>
 * </ul>
 *
 * <h2>Registration</h2>
 * The active store is selected by {@code bastion.storage.backend}. Custom implementations
 * can replace it via CDI:
 * <pre>{@code
 * @Alternative
 * @Priority(1)
 * @ApplicationScoped
 * public class JdbcAttemptStore implements AttemptStore {
 *     // ...
 * }
 * }</pre>
 *
 * @see bastion.adapter.out.storage.memory.InMemoryAttemptStore
 * @see bastion.adapter.out.storage.redis.RedisAttemptStore
 */
public interface AttemptStore {

    /**
     * Look up the record for a scope key.
     *
     * @param key the scope key value
     * @return Uni with the record, or empty if none exists
     */
    Uni<Optional<AttemptRecord>> find(String key);

    /**
     * Atomically record one failure for a scope.
     *
     * <p>If the existing record's last failure is older than {@code cooloff}
     * (and {@code cooloff} is not zero) the run restarts at one.
     *
     * @param scope the scope to increment
     * @param ipAddress client IP of this failure; username scopes keep it as their latest source IP
     * @param userAgent the (already truncated) user agent of this attempt
     * @param at when the failure happened
     * @param cooloff cool-off window, {@link Duration#ZERO} if lockouts never expire
     * @return Uni with the record after the increment
     */
    Uni<AttemptRecord> recordFailure(ScopeKey scope, String ipAddress, String userAgent, Instant at, Duration cooloff);

    /**
     * Remove the record for a scope key.
     *
     * @param key the scope key value
     * @return Uni with true if a record was removed
     */
    Uni<Boolean> clear(String key);

    /**
     * Remove every record scoped to an IP address (IP and username+IP scopes), and every
     * username scope whose most recent failure came from that address.
     *
     * @param ipAddress the IP address
     * @return Uni with the number of records removed
     */
    Uni<Integer> clearByIp(String ipAddress);

    /**
     * Remove every record scoped to a username (username and username+IP scopes).
     *
     * @param username the username
     * @return Uni with the number of records removed
     */
    Uni<Integer> clearByUsername(String username);

    /**
     * Remove all records.
     *
     * @return Uni with the number of records removed
     */
    Uni<Integer> clearAll();

    /**
     * Stream all records, including stale ones.
     *
     * @return Multi of records
     */
    Multi<AttemptRecord> streamAll();
}
