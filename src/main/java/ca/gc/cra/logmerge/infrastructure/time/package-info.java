/**
 * Time-extraction strategies: numeric epoch prefixes and {@code java.time} pattern prefixes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.infrastructure.time;
