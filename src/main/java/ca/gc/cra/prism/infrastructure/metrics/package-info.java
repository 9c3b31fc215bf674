/**
 * {@link ca.gc.cra.prism.application.port.MetricsPort} adapters: OpenTelemetry export and no-op.
 */
package ca.gc.cra.prism.infrastructure.metrics;
