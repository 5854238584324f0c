package bastion.adapter.in.dto;

import java.time.Instant;

import bastion.core.model.lockout.LoginAttempt;

/**
 * Login attempt reported by an authentication front end.
 *
 * <p>Only {@code success} is required. Missing IP and user agent are taken from the
 * request itself; a missing timestamp means now.
 */
public record LoginAttemptRequest(
        String username,
        String ipAddress,
        String userAgent,
        boolean success,
        Instant timestamp,
        String httpAccept,
        String pathInfo) {

    /**
     * Convert to a core attempt, filling gaps from the transport.
     */
    public LoginAttempt toModel(String resolvedIp, String headerUserAgent, Instant now) {
        return new LoginAttempt(
                username,
                ipAddress != null && !ipAddress.isBlank() ? ipAddress : resolvedIp,
                userAgent != null ? userAgent : headerUserAgent,
                success,
                timestamp != null ? timestamp : now,
                httpAccept,
                pathInfo);
    }
}
