/**
 * Value types shared by the merge engine: strategy outcomes, run modes, and run reports.
 * <p>All types are immutable and safe to share across worker threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.logmerge.domain.merge;
