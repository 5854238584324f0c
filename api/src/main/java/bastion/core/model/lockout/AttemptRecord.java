package bastion.core.model.lockout;

import java.time.Instant;

/**
 * Accumulated failed attempts for one scope key.
 *
 * <p>Records are immutable snapshots handed out by an {@link bastion.spi.AttemptStore}.
 * Whether a record is locked is never stored; it is derived on every read by
 * {@link bastion.core.service.lockout.LockoutEvaluator}.
 *
 * @param key the opaque scope key
 * @param scope the scope axis
 * @param username the username for username-bearing scopes, otherwise null
 * @param ipAddress the IP address for IP-bearing scopes; for username scopes the client IP of
 *     the most recent failure (may be null)
 * @param userAgent the (truncated) user agent of the most recent failure
 * @param failureCount failures since the last reset or restart
 * @param firstFailureAt first failure of the current run
 * @param lastFailureAt most recent failure
 */
public record AttemptRecord(
        String key,
        ScopeType scope,
        String username,
        String ipAddress,
        String userAgent,
        int failureCount,
        Instant firstFailureAt,
        Instant lastFailureAt) {

    /**
     * Start a new run of failures for a scope.
     */
    public static AttemptRecord first(ScopeKey scope, String sourceIp, Instant at, String userAgent) {
        final var ip = scope.ipAddress() != null ? scope.ipAddress() : sourceIp;
        return new AttemptRecord(scope.value(), scope.type(), scope.username(), ip, userAgent, 1, at, at);
    }

    /**
     * Return a copy with one more failure at the given time.
     */
    public AttemptRecord withFailure(String sourceIp, Instant at, String latestUserAgent) {
        final var ip = scope == ScopeType.USERNAME ? sourceIp : ipAddress;
        return new AttemptRecord(key, scope, username, ip, latestUserAgent, failureCount + 1, firstFailureAt, at);
    }
}
