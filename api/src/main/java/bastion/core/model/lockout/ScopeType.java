package bastion.core.model.lockout;

/**
 * Axis under which failed login attempts are counted.
 */
public enum ScopeType {
    /** Failures counted per client IP address (optionally per user agent as well). */
    IP("ip"),
    /** Failures counted per attempted username. */
    USERNAME("user"),
    /** Failures counted per (username, IP) pair. */
    USERNAME_AND_IP("userip");

    private final String prefix;

    ScopeType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Key prefix used when building scope keys of this type.
     *
     * @return prefix without the trailing separator
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Resolve a scope type from its key prefix.
     *
     * @param prefix the prefix
     * @return the scope type
     * @throws IllegalArgumentException if the prefix is unknown
     */
    public static ScopeType fromPrefix(String prefix) {
        for (var type : values()) {
            if (type.prefix.equals(prefix)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown scope prefix: " + prefix);
    }
}
