/**
 * Input validation helpers shared by the CLI and configuration layers. Every helper reports
 * problems as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.validation;
