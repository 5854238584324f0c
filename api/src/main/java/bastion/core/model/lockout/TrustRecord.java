package bastion.core.model.lockout;

import java.time.Instant;

/**
 * Recorded fact that a (username, ip) pair completed a full login and logout cycle.
 *
 * @param username the username
 * @param ipAddress the client IP address
 * @param firstTrustedAt the first logout that established trust
 * @param lastLogoutAt the most recent logout
 * @param logoutCount number of completed sessions
 */
public record TrustRecord(String username, String ipAddress, Instant firstTrustedAt, Instant lastLogoutAt, long logoutCount) {

    public static TrustRecord first(String username, String ipAddress, Instant at) {
        return new TrustRecord(username, ipAddress, at, at, 1);
    }

    public TrustRecord withLogout(Instant at) {
        return new TrustRecord(username, ipAddress, firstTrustedAt, at, logoutCount + 1);
    }
}
