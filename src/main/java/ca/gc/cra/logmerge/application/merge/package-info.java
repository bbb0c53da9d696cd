/**
 * Merge engine: per-source cursors, the ordered k-way merger, the concurrent worker pool, and the
 * use case that opens, drives, closes, and optionally removes the streams of one job.
 *
 * <p>Failures surface as {@link ca.gc.cra.logmerge.application.merge.MergeException} subclasses so the
 * CLI can map each category to its own exit code.</p>
 */
package ca.gc.cra.logmerge.application.merge;
