package bastion.core.model.lockout;

import java.time.Instant;

/**
 * Emitted once per Allowed to Locked transition of a scope.
 *
 * @param timestamp when the lockout happened
 * @param request the attempt that triggered the lockout
 * @param username the attempted username (may be null)
 * @param ipAddress the client IP address (may be null)
 * @param scopeKey the scope key that reached the limit
 * @param failureCount the failure count at the transition
 */
public record UserLockedOut(
        Instant timestamp, LoginAttempt request, String username, String ipAddress, String scopeKey, int failureCount) {}
