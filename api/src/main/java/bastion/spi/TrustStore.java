package bastion.spi;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import bastion.core.model.lockout.TrustRecord;

/**
 * SPI for (username, ip) pairs that completed a full login and logout cycle.
 *
 * <p>Trust records are created or updated on logout and only removed by
 * {@link #revoke}.
 */
public interface TrustStore {

    /**
     * Create or update the trust record for a pair.
     *
     * @param username the username
     * @param ipAddress the client IP address
     * @param at logout time
     * @return Uni with the stored record
     */
    Uni<TrustRecord> markTrusted(String username, String ipAddress, Instant at);

    /**
     * Look up the trust record for a pair.
     *
     * @param username the username
     * @param ipAddress the client IP address
     * @return Uni with the record, or empty if the pair is not trusted
     */
    Uni<Optional<TrustRecord>> find(String username, String ipAddress);

    /**
     * Remove trust records. A null argument matches any value; both null removes all.
     *
     * @param username the username, or null
     * @param ipAddress the IP address, or null
     * @return Uni with the number of records removed
     */
    Uni<Integer> revoke(String username, String ipAddress);
}
