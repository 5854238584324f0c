package bastion.core.model.lockout;

import java.time.Instant;

/**
 * Administrative view of an attempt record evaluated at a point in time.
 *
 * @param record the stored record
 * @param verdict the verdict at evaluation time
 * @param expired whether the record falls outside the cool-off window
 * @param remainingAttempts failures left before lockout
 * @param lockedUntil when the record stops counting, null if lockouts never expire
 */
public record ScopeStatus(AttemptRecord record, Verdict verdict, boolean expired, int remainingAttempts, Instant lockedUntil) {

    public boolean locked() {
        return verdict.isLocked();
    }
}
