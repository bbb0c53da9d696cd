package ca.gc.cra.logmerge.api;

/**
 * Process exit codes returned by the logmerge CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every source merged. */
  SUCCESS(0),
  /** Arguments, YAML, or paths failed validation; nothing was opened. */
  INVALID_ARGS(2),
  /** A source or the destination could not be read, written, or removed. */
  IO_ERROR(3),
  /** The assembled job was rejected before running. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** A time or filter strategy stopped an ordered merge. */
  ABORTED(6),
  /** A concurrent merge finished but at least one source failed. */
  PARTIAL(7),
  /** Cancelled by a signal or interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
