package bastion.core.model.lockout;

import java.time.Instant;

/**
 * Result of recording or checking a login attempt.
 *
 * @param verdict the gate decision
 * @param key the scope key that caused the lockout (null if allowed)
 * @param failureCount highest failure count among the evaluated scopes
 * @param remainingAttempts failures left before lockout (0 if locked)
 * @param lockedUntil when the lockout expires by itself (null if allowed or if lockouts never expire)
 * @param trusted whether the (username, ip) pair had completed a full session before
 * @param reason short machine-readable reason
 */
public record AttemptOutcome(
        Verdict verdict,
        String key,
        int failureCount,
        int remainingAttempts,
        Instant lockedUntil,
        boolean trusted,
        String reason) {

    public static final String REASON_UNDER_LIMIT = "under_limit";
    public static final String REASON_MAX_FAILED_ATTEMPTS = "max_failed_attempts";
    public static final String REASON_IP_BLACKLISTED = "ip_blacklisted";
    public static final String REASON_IP_WHITELISTED = "ip_whitelisted";
    public static final String REASON_DISABLED = "disabled";
    public static final String REASON_NO_SCOPE = "no_scope";
    public static final String REASON_STORE_UNAVAILABLE = "store_unavailable";

    public boolean allowed() {
        return verdict == Verdict.ALLOWED;
    }

    public static AttemptOutcome allow(int failureCount, int remainingAttempts, boolean trusted) {
        return new AttemptOutcome(Verdict.ALLOWED, null, failureCount, remainingAttempts, null, trusted, REASON_UNDER_LIMIT);
    }

    public static AttemptOutcome allow(String reason) {
        return new AttemptOutcome(Verdict.ALLOWED, null, 0, 0, null, false, reason);
    }

    public static AttemptOutcome locked(String key, int failureCount, Instant lockedUntil) {
        return new AttemptOutcome(Verdict.LOCKED, key, failureCount, 0, lockedUntil, false, REASON_MAX_FAILED_ATTEMPTS);
    }

    public static AttemptOutcome locked(String reason) {
        return new AttemptOutcome(Verdict.LOCKED, null, 0, 0, null, false, reason);
    }

    public AttemptOutcome withTrusted(boolean trustedPair) {
        return new AttemptOutcome(verdict, key, failureCount, remainingAttempts, lockedUntil, trustedPair, reason);
    }
}
