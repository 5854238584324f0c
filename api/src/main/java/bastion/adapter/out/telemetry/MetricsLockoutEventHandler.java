package bastion.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import bastion.core.model.lockout.UserLockedOut;
import bastion.spi.LockoutEventHandler;

/**
 * Lockout event handler that counts lockouts as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code bastion.lockouts.total} - Lockouts by scope type (ip, user, userip)</li>
 * </ul>
 */
public class MetricsLockoutEventHandler implements LockoutEventHandler {

    static final String LOCKOUTS_METRIC = "bastion.lockouts.total";

    private final MeterRegistry registry;

    public MetricsLockoutEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(UserLockedOut event) {
        Counter.builder(LOCKOUTS_METRIC)
                .description("Scopes locked out after too many failed logins")
                .tag("scope", scopeType(event.scopeKey()))
                .register(registry)
                .increment();
    }

    private static String scopeType(String scopeKey) {
        if (scopeKey == null) {
            return "unknown";
        }
        final var separator = scopeKey.indexOf(':');
        return separator > 0 ? scopeKey.substring(0, separator) : "unknown";
    }
}
