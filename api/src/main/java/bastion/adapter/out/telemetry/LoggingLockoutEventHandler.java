package bastion.adapter.out.telemetry;

import org.jboss.logging.Logger;

import bastion.core.model.lockout.UserLockedOut;
import bastion.spi.LockoutEventHandler;

/**
 * Lockout event handler that logs events using JBoss Logging.
 *
 * <p>This is a built-in handler with priority 0, discovered via ServiceLoader.
 * Events are logged at WARN on the {@code bastion.security} category so they can be
 * routed to a dedicated security log.
 */
public class LoggingLockoutEventHandler implements LockoutEventHandler {

    private static final Logger LOG = Logger.getLogger("bastion.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public void handle(UserLockedOut event) {
        LOG.warnf(
                "USER_LOCKED_OUT: username=%s ip=%s scope=%s failures=%d path=%s",
                event.username(),
                event.ipAddress(),
                event.scopeKey(),
                event.failureCount(),
                event.request() != null ? event.request().pathInfo() : null);
    }
}
