package bastion.core.service.lockout;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import bastion.core.model.lockout.UserLockedOut;
import bastion.spi.LockoutEventHandler;

/**
 * Fans out {@link UserLockedOut} events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} at startup and may also be
 * registered at runtime with {@link #onLockout}. Dispatch is synchronous, in priority
 * order (highest first), on the thread that recorded the failure. A failing handler is
 * logged and skipped; it never changes the verdict and never stops the other handlers.
 */
@ApplicationScoped
public class LockoutEventDispatcher {

    private static final Logger LOG = Logger.getLogger(LockoutEventDispatcher.class);

    private static final Comparator<LockoutEventHandler> BY_PRIORITY =
            Comparator.comparingInt(LockoutEventHandler::priority).reversed();

    private final List<LockoutEventHandler> handlers = new CopyOnWriteArrayList<>();

    @PostConstruct
    void init() {
        var loaded = ServiceLoader.load(LockoutEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .filter(LockoutEventHandler::isAvailable)
                .toList();

        loaded.forEach(this::onLockout);

        if (loaded.isEmpty()) {
            LOG.debug("No lockout event handlers discovered via ServiceLoader");
        } else {
            LOG.infof(
                    "Loaded %d lockout event handler(s): %s",
                    loaded.size(),
                    loaded.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }
    }

    /**
     * Register a handler.
     *
     * @param handler the handler
     * @return registration that removes the handler when closed
     */
    public Registration onLockout(LockoutEventHandler handler) {
        synchronized (handlers) {
            handlers.add(handler);
            handlers.sort(BY_PRIORITY);
        }
        return () -> handlers.remove(handler);
    }

    /**
     * Register a plain callback with default priority.
     *
     * @param name name used in log messages
     * @param callback the callback
     * @return registration that removes the callback when closed
     */
    public Registration onLockout(String name, Consumer<UserLockedOut> callback) {
        return onLockout(new LockoutEventHandler() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void handle(UserLockedOut event) {
                callback.accept(event);
            }
        });
    }

    /**
     * Deliver an event to every registered handler.
     *
     * @param event the event
     */
    public void dispatch(UserLockedOut event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                LOG.warnf("Lockout handler %s failed for %s: %s", handler.name(), event.scopeKey(), e.getMessage());
            }
        }
    }

    public List<LockoutEventHandler> getHandlers() {
        return List.copyOf(handlers);
    }

    /**
     * Handle for removing a registered handler.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
