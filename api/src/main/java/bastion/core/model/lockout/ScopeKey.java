package bastion.core.model.lockout;

import java.util.Objects;

/**
 * Identity under which failures are counted.
 *
 * <p>The {@link #value()} is an opaque string that is unique per scope. The username and
 * IP address are carried alongside so stores can answer "clear everything scoped to this
 * IP" without parsing keys.
 *
 * <p>Key formats:
 * <ul>
 *   <li>{@code ip:<ip>} or {@code ip:<ip>|ua:<hash>}</li>
 *   <li>{@code user:<username>}</li>
 *   <li>{@code userip:<username length>:<username>:<ip>} (optionally {@code |ua:<hash>})</li>
 * </ul>
 *
 * @param type the scope axis
 * @param value the opaque key
 * @param username the username for USERNAME and USERNAME_AND_IP scopes, otherwise null
 * @param ipAddress the IP address for IP and USERNAME_AND_IP scopes, otherwise null
 */
public record ScopeKey(ScopeType type, String value, String username, String ipAddress) {

    private static final String UA_SEPARATOR = "|ua:";

    public ScopeKey {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ScopeKey ip(String ip, String userAgentHash) {
        var value = ScopeType.IP.prefix() + ":" + ip;
        if (userAgentHash != null) {
            value = value + UA_SEPARATOR + userAgentHash;
        }
        return new ScopeKey(ScopeType.IP, value, null, ip);
    }

    public static ScopeKey username(String username) {
        return new ScopeKey(ScopeType.USERNAME, ScopeType.USERNAME.prefix() + ":" + username, username, null);
    }

    public static ScopeKey usernameAndIp(String username, String ip, String userAgentHash) {
        // Length prefix keeps "a:b"+"c" and "a"+"b:c" (IPv6) apart
        var value = ScopeType.USERNAME_AND_IP.prefix() + ":" + username.length() + ":" + username + ":" + ip;
        if (userAgentHash != null) {
            value = value + UA_SEPARATOR + userAgentHash;
        }
        return new ScopeKey(ScopeType.USERNAME_AND_IP, value, username, ip);
    }

    @Override
    public String toString() {
        return value;
    }
}
