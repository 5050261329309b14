package com.selfmx.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Optional;

/**
 * Holds the process wide meter registry once {@code MetricsEndpoint} has created it.
 *
 * <p>Services record through {@link GatewayMetrics}, which skips recording while nothing
 * is registered.
 */
public final class MetricsRegistry {
    private static volatile MeterRegistry registry;

    private MetricsRegistry() {
    }

    /**
     * Sets the registry, or clears it with {@code null}.
     *
     * @param meterRegistry Registry.
     */
    public static void register(MeterRegistry meterRegistry) {
        registry = meterRegistry;
    }

    /**
     * Current registry.
     *
     * @return Registry, empty before startup or after a reset.
     */
    public static Optional<MeterRegistry> current() {
        return Optional.ofNullable(registry);
    }
}
