/**
 * Configuration for the logmerge CLI: embedded defaults, YAML loading, precedence merging, the
 * typed {@link ca.gc.cra.logmerge.config.MergeConfig}, and the composition root.
 * <p>Configuration objects are immutable. Validation failures surface as
 * {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.logmerge.config;
