package bastion.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import jakarta.enterprise.inject.Instance;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import bastion.core.service.lockout.LockoutEventDispatcher;
import bastion.spi.LockoutEventHandler;

@DisplayName("LockoutTelemetryInitializer")
class LockoutTelemetryInitializerTest {

    private LockoutEventDispatcher dispatcher;
    private Instance<MeterRegistry> meterRegistry;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        dispatcher = new LockoutEventDispatcher();
        meterRegistry = mock(Instance.class);
    }

    @Test
    @DisplayName("should register the metrics handler when a registry is available")
    void shouldRegisterMetricsHandler() {
        when(meterRegistry.isResolvable()).thenReturn(true);
        when(meterRegistry.get()).thenReturn(new SimpleMeterRegistry());

        new LockoutTelemetryInitializer(dispatcher, meterRegistry).onStart(null);

        assertEquals(
                List.of("metrics"),
                dispatcher.getHandlers().stream().map(LockoutEventHandler::name).toList());
    }

    @Test
    @DisplayName("should skip registration without a registry")
    void shouldSkipWithoutRegistry() {
        when(meterRegistry.isResolvable()).thenReturn(false);

        new LockoutTelemetryInitializer(dispatcher, meterRegistry).onStart(null);

        assertTrue(dispatcher.getHandlers().isEmpty());
    }
}
