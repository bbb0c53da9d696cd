/**
 * <strong>Purpose:</strong> Ports defining the source -> merge -> sink contracts and the pluggable strategies.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters in {@code infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Sources and sinks are single-threaded; strategies, error sinks, and metrics may be
 * called from several workers in concurrent mode.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.application.port;
