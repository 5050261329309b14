/**
 * Micrometer metrics for the gateway.
 *
 * <p>{@link com.selfmx.metrics.MetricsRegistry} holds the Prometheus registry created by the
 * metrics endpoint; {@link com.selfmx.metrics.GatewayMetrics} exposes the gateway counters.
 */
package com.selfmx.metrics;
