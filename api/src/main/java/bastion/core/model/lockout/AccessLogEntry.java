package bastion.core.model.lockout;

import java.time.Instant;

/**
 * Audit trail entry for one successful login and its logout.
 *
 * @param id store-assigned identifier, increasing with insertion order (0 before append)
 * @param attemptTime when the login attempt was made
 * @param username the username
 * @param ipAddress the client IP address
 * @param userAgent the (truncated) user agent
 * @param httpAccept the Accept header of the login request
 * @param pathInfo the path of the login request
 * @param trusted whether the pair was already trusted at login time
 * @param loginTime when the login was accepted
 * @param logoutTime when the session ended, null while open
 */
public record AccessLogEntry(
        long id,
        Instant attemptTime,
        String username,
        String ipAddress,
        String userAgent,
        String httpAccept,
        String pathInfo,
        boolean trusted,
        Instant loginTime,
        Instant logoutTime) {

    public boolean open() {
        return logoutTime == null;
    }

    public AccessLogEntry withId(long newId) {
        return new AccessLogEntry(
                newId, attemptTime, username, ipAddress, userAgent, httpAccept, pathInfo, trusted, loginTime, logoutTime);
    }

    public AccessLogEntry withLogoutTime(Instant at) {
        return new AccessLogEntry(
                id, attemptTime, username, ipAddress, userAgent, httpAccept, pathInfo, trusted, loginTime, at);
    }
}
