package bastion.core.model.lockout;

import java.time.Instant;
import java.util.Objects;

/**
 * A single login submission as reported by the authentication pipeline.
 *
 * <p>This is also the request context attached to {@link UserLockedOut} events.
 *
 * @param username the attempted username (may be null or blank)
 * @param ipAddress the client IP address (may be null)
 * @param userAgent the client user agent (may be null, may be very long)
 * @param success whether the credentials were valid
 * @param timestamp when the attempt happened
 * @param httpAccept the Accept header of the login request (may be null)
 * @param pathInfo the path of the login request (may be null)
 */
public record LoginAttempt(
        String username,
        String ipAddress,
        String userAgent,
        boolean success,
        Instant timestamp,
        String httpAccept,
        String pathInfo) {

    public LoginAttempt {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static LoginAttempt failure(String username, String ipAddress, String userAgent, Instant timestamp) {
        return new LoginAttempt(username, ipAddress, userAgent, false, timestamp, null, null);
    }

    public static LoginAttempt success(String username, String ipAddress, String userAgent, Instant timestamp) {
        return new LoginAttempt(username, ipAddress, userAgent, true, timestamp, null, null);
    }
}
