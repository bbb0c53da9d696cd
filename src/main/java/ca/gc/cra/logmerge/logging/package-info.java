/**
 * Logging utilities: runtime verbosity switch and bounded record previews.
 * <p>Backed by SLF4J with Logback as the binding; no metrics are emitted here.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.logging;
