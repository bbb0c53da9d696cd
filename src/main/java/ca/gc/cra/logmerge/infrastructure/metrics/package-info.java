/**
 * OpenTelemetry implementation of the metrics port, with an OTLP gRPC exporter or none.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.infrastructure.metrics;
