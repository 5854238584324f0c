package bastion.core.model.lockout;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import bastion.core.config.LockoutConfig;

/**
 * Validated lockout settings used by the decision engine.
 *
 * <p>Built once at startup from {@link LockoutConfig}. Invalid values raise
 * {@link LockoutConfigurationException}.
 *
 * @param enabled master switch
 * @param failureLimit failures that lock a scope (at least 1)
 * @param cooloffTime cool-off window, {@link Duration#ZERO} for no expiry
 * @param combinationUserAndIp scope by (username, ip) pair
 * @param useUserAgent include the user agent in IP scopes
 * @param onlyUserFailures scope by username only
 * @param failOpen verdict on store failure
 * @param userAgentMaxLength truncation bound for stored user agents
 * @param ipWhitelist IPs never locked out
 * @param ipBlacklist IPs always locked out
 */
public record LockoutPolicy(
        boolean enabled,
        int failureLimit,
        Duration cooloffTime,
        boolean combinationUserAndIp,
        boolean useUserAgent,
        boolean onlyUserFailures,
        boolean failOpen,
        int userAgentMaxLength,
        Set<String> ipWhitelist,
        Set<String> ipBlacklist) {

    public static final int DEFAULT_FAILURE_LIMIT = 3;
    public static final Duration DEFAULT_COOLOFF_TIME = Duration.ofHours(1);
    public static final int DEFAULT_USER_AGENT_MAX_LENGTH = 255;

    public LockoutPolicy {
        if (failureLimit < 1) {
            throw new LockoutConfigurationException("failure-limit must be at least 1, was " + failureLimit);
        }
        if (cooloffTime == null || cooloffTime.isNegative()) {
            throw new LockoutConfigurationException("cooloff-time must not be negative, was " + cooloffTime);
        }
        if (userAgentMaxLength < 1) {
            throw new LockoutConfigurationException(
                    "user-agent-max-length must be at least 1, was " + userAgentMaxLength);
        }
        if (combinationUserAndIp && onlyUserFailures) {
            throw new LockoutConfigurationException(
                    "lock-out-by-combination-user-and-ip and only-user-failures are mutually exclusive");
        }
        ipWhitelist = normalize(ipWhitelist);
        ipBlacklist = normalize(ipBlacklist);
    }

    /**
     * Build a policy from the configuration mapping.
     *
     * @param config the configuration
     * @return validated policy
     * @throws LockoutConfigurationException if a value is invalid
     */
    public static LockoutPolicy from(LockoutConfig config) {
        return new LockoutPolicy(
                config.enabled(),
                config.failureLimit(),
                config.cooloffTime(),
                config.lockOutByCombinationUserAndIp(),
                config.useUserAgent(),
                config.onlyUserFailures(),
                config.failOpen(),
                config.userAgentMaxLength(),
                Set.copyOf(config.ipWhitelist().orElse(List.of())),
                Set.copyOf(config.ipBlacklist().orElse(List.of())));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether lockouts expire by themselves.
     */
    public boolean expires() {
        return !cooloffTime.isZero();
    }

    public boolean isWhitelisted(String ip) {
        return ip != null && ipWhitelist.contains(ip.trim());
    }

    public boolean isBlacklisted(String ip) {
        return ip != null && ipBlacklist.contains(ip.trim());
    }

    /**
     * Truncate a user agent to the configured bound.
     *
     * @param userAgent raw user agent, may be null
     * @return truncated user agent, or null
     */
    public String truncateUserAgent(String userAgent) {
        if (userAgent == null || userAgent.length() <= userAgentMaxLength) {
            return userAgent;
        }
        return userAgent.substring(0, userAgentMaxLength);
    }

    private static Set<String> normalize(Collection<String> ips) {
        if (ips == null) {
            return Set.of();
        }
        return ips.stream()
                .filter(ip -> ip != null && !ip.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Builder used by tests and embedding code that does not go through CDI.
     */
    public static final class Builder {
        private boolean enabled = true;
        private int failureLimit = DEFAULT_FAILURE_LIMIT;
        private Duration cooloffTime = DEFAULT_COOLOFF_TIME;
        private boolean combinationUserAndIp;
        private boolean useUserAgent;
        private boolean onlyUserFailures;
        private boolean failOpen = true;
        private int userAgentMaxLength = DEFAULT_USER_AGENT_MAX_LENGTH;
        private Set<String> ipWhitelist = Set.of();
        private Set<String> ipBlacklist = Set.of();

        private Builder() {}

        public Builder enabled(boolean value) {
            this.enabled = value;
            return this;
        }

        public Builder failureLimit(int value) {
            this.failureLimit = value;
            return this;
        }

        public Builder cooloffTime(Duration value) {
            this.cooloffTime = value;
            return this;
        }

        public Builder combinationUserAndIp(boolean value) {
            this.combinationUserAndIp = value;
            return this;
        }

        public Builder useUserAgent(boolean value) {
            this.useUserAgent = value;
            return this;
        }

        public Builder onlyUserFailures(boolean value) {
            this.onlyUserFailures = value;
            return this;
        }

        public Builder failOpen(boolean value) {
            this.failOpen = value;
            return this;
        }

        public Builder userAgentMaxLength(int value) {
            this.userAgentMaxLength = value;
            return this;
        }

        public Builder ipWhitelist(String... ips) {
            this.ipWhitelist = Set.of(ips);
            return this;
        }

        public Builder ipBlacklist(String... ips) {
            this.ipBlacklist = Set.of(ips);
            return this;
        }

        public LockoutPolicy build() {
            return new LockoutPolicy(
                    enabled,
                    failureLimit,
                    cooloffTime,
                    combinationUserAndIp,
                    useUserAgent,
                    onlyUserFailures,
                    failOpen,
                    userAgentMaxLength,
                    ipWhitelist,
                    ipBlacklist);
        }
    }
}
