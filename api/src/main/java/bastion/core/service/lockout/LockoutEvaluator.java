package bastion.core.service.lockout;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import bastion.core.model.lockout.AttemptRecord;
import bastion.core.model.lockout.LockoutPolicy;
import bastion.core.model.lockout.Verdict;

/**
 * Read-time lockout decision for an attempt record snapshot.
 *
 * <p>Locked is never stored. It is recomputed on every call from the failure count and
 * the time of the last failure, so expiry needs no background sweep. This class never
 * mutates state and is safe to call without holding any store lock.
 */
@ApplicationScoped
public class LockoutEvaluator {

    private final LockoutPolicy policy;

    public LockoutEvaluator(LockoutPolicy policy) {
        this.policy = policy;
    }

    /**
     * Decide whether a scope is locked.
     *
     * <ol>
     *   <li>no record: allowed</li>
     *   <li>last failure older than the cool-off window: expired, allowed</li>
     *   <li>failure count at or above the limit: locked</li>
     *   <li>otherwise allowed</li>
     * </ol>
     *
     * @param record the record snapshot, may be null
     * @param now evaluation time
     * @return the verdict
     */
    public Verdict decide(AttemptRecord record, Instant now) {
        if (record == null || isExpired(record, now)) {
            return Verdict.ALLOWED;
        }
        return record.failureCount() >= policy.failureLimit() ? Verdict.LOCKED : Verdict.ALLOWED;
    }

    public Verdict decide(Optional<AttemptRecord> record, Instant now) {
        return decide(record.orElse(null), now);
    }

    /**
     * Whether the record's failures fall outside the cool-off window.
     *
     * <p>Strictly greater than: a record exactly one window old still counts.
     */
    public boolean isExpired(AttemptRecord record, Instant now) {
        if (!policy.expires()) {
            return false;
        }
        return Duration.between(record.lastFailureAt(), now).compareTo(policy.cooloffTime()) > 0;
    }

    /**
     * Failures that still count at {@code now}: zero for missing or expired records.
     */
    public int effectiveFailures(AttemptRecord record, Instant now) {
        if (record == null || isExpired(record, now)) {
            return 0;
        }
        return record.failureCount();
    }

    public int remainingAttempts(AttemptRecord record, Instant now) {
        return Math.max(0, policy.failureLimit() - effectiveFailures(record, now));
    }

    /**
     * When a locked record becomes allowed again without a reset.
     *
     * @return expiry instant, or empty if lockouts never expire
     */
    public Optional<Instant> lockedUntil(AttemptRecord record) {
        if (record == null || !policy.expires()) {
            return Optional.empty();
        }
        return Optional.of(record.lastFailureAt().plus(policy.cooloffTime()));
    }

    public int failureLimit() {
        return policy.failureLimit();
    }
}
