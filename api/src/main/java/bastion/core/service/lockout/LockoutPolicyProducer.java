package bastion.core.service.lockout;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import bastion.core.config.LockoutConfig;
import bastion.core.model.lockout.LockoutPolicy;

/**
 * Builds the validated {@link LockoutPolicy} from configuration.
 *
 * <p>The policy is resolved on startup so an invalid configuration fails the boot
 * with a {@link bastion.core.model.lockout.LockoutConfigurationException} instead of
 * surfacing on the first login.
 */
@ApplicationScoped
public class LockoutPolicyProducer {

    private static final Logger LOG = Logger.getLogger(LockoutPolicyProducer.class);

    private final LockoutConfig config;

    @Inject
    public LockoutPolicyProducer(LockoutConfig config) {
        this.config = config;
    }

    @Produces
    @Singleton
    public LockoutPolicy lockoutPolicy() {
        return LockoutPolicy.from(config);
    }

    void onStart(@Observes StartupEvent event, LockoutPolicy policy) {
        LOG.infof(
                "Lockout policy: enabled=%s, failureLimit=%d, cooloff=%s, combination=%s, onlyUser=%s, useUserAgent=%s, failOpen=%s",
                policy.enabled(),
                policy.failureLimit(),
                policy.expires() ? policy.cooloffTime() : "never",
                policy.combinationUserAndIp(),
                policy.onlyUserFailures(),
                policy.useUserAgent(),
                policy.failOpen());
    }
}
