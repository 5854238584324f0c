package bastion.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import bastion.core.service.lockout.LockoutEventDispatcher;
import bastion.spi.LockoutEventHandler;

/**
 * Registers the metrics lockout handler once the meter registry is available.
 */
@ApplicationScoped
public class LockoutTelemetryInitializer {

    private static final Logger LOG = Logger.getLogger(LockoutTelemetryInitializer.class);

    private final LockoutEventDispatcher dispatcher;
    private final Instance<MeterRegistry> meterRegistry;

    @Inject
    public LockoutTelemetryInitializer(LockoutEventDispatcher dispatcher, Instance<MeterRegistry> meterRegistry) {
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
    }

    void onStart(@Observes StartupEvent event) {
        if (!meterRegistry.isResolvable()) {
            LOG.debug("No MeterRegistry available - lockout metrics disabled");
            return;
        }
        dispatcher.onLockout(new MetricsLockoutEventHandler(meterRegistry.get()));
        LOG.infof(
                "Registered lockout metrics handler, active handlers: %s",
                dispatcher.getHandlers().stream().map(LockoutEventHandler::name).toList());
    }
}
