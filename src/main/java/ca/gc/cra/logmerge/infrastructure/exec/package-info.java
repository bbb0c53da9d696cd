/**
 * Executor helpers with named, non-daemon worker threads and explicit uncaught-exception handling.
 */
package ca.gc.cra.logmerge.infrastructure.exec;
