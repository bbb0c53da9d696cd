/**
 * File-backed adapters for the merge ports: line-splitting sources, newline-terminated sinks,
 * optional gzip on either side, and source deletion.
 * <p>Adapters are single-threaded; each source is driven by one cursor or worker and the sink by
 * the single writer.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.infrastructure.io;
