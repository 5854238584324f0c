package bastion.spi;

import bastion.core.model.lockout.UserLockedOut;

/**
 * SPI for reacting to lockout transitions.
 *
 * <p>Platform teams can implement this interface to integrate with their
 * alerting systems. Implementations are discovered via {@link java.util.ServiceLoader}
 * or registered explicitly through
 * {@link bastion.core.service.lockout.LockoutEventDispatcher#onLockout}.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs lockouts using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Counts lockouts with Micrometer (priority 10)</li>
 * </ul>
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class SlackLockoutEventHandler implements LockoutEventHandler {
 *     @Override
 *     public String name() { return "slack"; }
 *
 *     @Override
 *     public void handle(UserLockedOut event) {
 *         slack.post("#security", "Locked out " + event.username() + " from " + event.ipAddress());
 *     }
 * }
 * }</pre>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/bastion.spi.LockoutEventHandler}
 */
public interface LockoutEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name
     */
    String name();

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     *
     * @return true if available
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a lockout transition.
     *
     * <p>Called inline on the request path; implementations should hand slow work off.
     * Exceptions are logged by the dispatcher and never affect the verdict.
     *
     * @param event the lockout event
     */
    void handle(UserLockedOut event);
}
