/**
 * Command-line entry points: the dispatcher and the {@code merge} command.
 * <p>Arguments are {@code key=value} pairs plus bare flags; results map to {@link ca.gc.cra.logmerge.api.ExitCode}.
 * User-facing output goes through {@link ca.gc.cra.logmerge.api.CliPrinter}, diagnostics through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.api;
