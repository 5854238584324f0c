package bastion.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for login lockout (brute force protection).
 *
 * <p>Configuration prefix: {@code bastion.lockout}
 *
 * <p>Failed attempts are counted per scope. By default both the client IP and the
 * attempted username are scopes, and an attempt is blocked when either is locked.
 *
 * @see bastion.core.model.lockout.LockoutPolicy
 * @see bastion.core.service.lockout.AttemptRecorder
 */
@ConfigMapping(prefix = "bastion.lockout")
public interface LockoutConfig {

    /**
     * Enable lockout tracking.
     *
     * <p>When disabled every attempt is allowed and nothing is recorded.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Failed attempts that lock a scope.
     *
     * <p>The attempt that brings a scope's count to this value is the one that is locked.
     *
     * @return failure limit (default: 3)
     */
    @WithDefault("3")
    int failureLimit();

    /**
     * Cooling-off window measured from the most recent failure.
     *
     * <p>Once the window has elapsed the scope is allowed again without a reset.
     * {@code PT0S} keeps lockouts until an operator resets them.
     *
     * @return cool-off duration (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration cooloffTime();

    /**
     * Count failures per (username, IP) pair instead of per IP and per username.
     *
     * @return true for combination scoping (default: false)
     */
    @WithDefault("false")
    boolean lockOutByCombinationUserAndIp();

    /**
     * Include the user agent in IP-based scopes.
     *
     * @return true if the user agent participates in scoping (default: false)
     */
    @WithDefault("false")
    boolean useUserAgent();

    /**
     * Count failures per username only and ignore the client IP.
     *
     * @return true for username-only scoping (default: false)
     */
    @WithDefault("false")
    boolean onlyUserFailures();

    /**
     * Verdict when the attempt store cannot be reached.
     *
     * <p>Failing open keeps a storage outage from becoming a login outage.
     *
     * @return true to allow on store failure, false to lock (default: true)
     */
    @WithDefault("true")
    boolean failOpen();

    /**
     * Maximum stored user agent length. Longer values are truncated.
     *
     * @return max length (default: 255)
     */
    @WithDefault("255")
    int userAgentMaxLength();

    /**
     * Client IPs that are never locked out.
     */
    Optional<List<String>> ipWhitelist();

    /**
     * Client IPs that are always locked out.
     */
    Optional<List<String>> ipBlacklist();

    /**
     * Resolve the client IP from {@code Forwarded} / {@code X-Forwarded-For} headers
     * when the caller does not supply one.
     *
     * @return true if forwarding headers are trusted (default: false)
     */
    @WithDefault("false")
    boolean behindReverseProxy();
}
