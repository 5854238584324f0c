package bastion.core.service.lockout;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import bastion.core.model.lockout.LockoutPolicy;
import bastion.core.model.lockout.ScopeKey;

/**
 * Maps a login attempt's (username, ip) to the scope keys its failures are counted under.
 *
 * <p>Modes:
 * <ul>
 *   <li>default: the IP scope and the username scope, blocked when either is locked</li>
 *   <li>combination: a single (username, ip) scope</li>
 *   <li>only-user-failures: a single username scope</li>
 * </ul>
 *
 * <p>A blank username always falls back to IP scoping. A blank IP drops the IP-bearing
 * scopes. This class is a pure function of its inputs and the policy.
 */
@ApplicationScoped
public class ScopingPolicy {

    private static final int USER_AGENT_HASH_BYTES = 8;

    private final LockoutPolicy policy;

    public ScopingPolicy(LockoutPolicy policy) {
        this.policy = policy;
    }

    /**
     * Compute the ordered scope keys for an attempt.
     *
     * @param username attempted username, may be null or blank
     * @param ip client IP address, may be null or blank
     * @param userAgent client user agent, may be null; only used when user agent scoping is on
     * @return scope keys, empty if neither username nor IP is usable
     */
    public List<ScopeKey> keysFor(String username, String ip, String userAgent) {
        final var user = normalize(username);
        final var address = normalize(ip);
        final var userAgentHash = policy.useUserAgent() ? userAgentHash(userAgent) : null;

        if (user == null) {
            return address == null ? List.of() : List.of(ScopeKey.ip(address, userAgentHash));
        }

        if (policy.onlyUserFailures()) {
            return List.of(ScopeKey.username(user));
        }

        if (policy.combinationUserAndIp()) {
            return address == null
                    ? List.of(ScopeKey.username(user))
                    : List.of(ScopeKey.usernameAndIp(user, address, userAgentHash));
        }

        final var keys = new ArrayList<ScopeKey>(2);
        if (address != null) {
            keys.add(ScopeKey.ip(address, userAgentHash));
        }
        keys.add(ScopeKey.username(user));
        return List.copyOf(keys);
    }

    private String userAgentHash(String userAgent) {
        final var truncated = policy.truncateUserAgent(userAgent);
        final var value = truncated == null ? "" : truncated;
        try {
            final var digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, USER_AGENT_HASH_BYTES);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
