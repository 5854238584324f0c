package bastion.adapter.in.dto;

/**
 * End of a session for a (username, ip) pair. A missing IP is taken from the request.
 */
public record LogoutRequest(String username, String ipAddress) {}
