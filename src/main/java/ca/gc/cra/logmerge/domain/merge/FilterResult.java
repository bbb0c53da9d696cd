package ca.gc.cra.logmerge.domain.merge;

import java.util.Objects;

/**
 * Result of filtering one accepted record.
 *
 * @param record bytes to emit (possibly rewritten); required for {@link Action#ACCEPT}
 * @param action what the merge should do with the record
 * @param cause caller-supplied reason for {@link Action#STOP}; {@code null} otherwise
 * @since 0.1.0
 */
public record FilterResult(byte[] record, Action action, Exception cause) {
  private static final FilterResult SKIP = new FilterResult(null, Action.SKIP, null);

  /**
   * Validates that accepted results carry bytes.
   */
  public FilterResult {
    Objects.requireNonNull(action, "action");
    if (action == Action.ACCEPT) {
      Objects.requireNonNull(record, "record");
    }
  }

  public static FilterResult accept(byte[] record) {
    return new FilterResult(record, Action.ACCEPT, null);
  }

  public static FilterResult skip() {
    return SKIP;
  }

  public static FilterResult stop(Exception cause) {
    return new FilterResult(null, Action.STOP, cause);
  }
}
