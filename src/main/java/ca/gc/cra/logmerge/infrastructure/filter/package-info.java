/**
 * Record filters: include/exclude patterns, stop patterns, source tagging, and chaining.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.infrastructure.filter;
