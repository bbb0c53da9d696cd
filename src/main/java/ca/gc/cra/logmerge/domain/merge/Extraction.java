package ca.gc.cra.logmerge.domain.merge;

import java.util.Objects;

/**
 * Result of extracting a sort key from one raw record.
 *
 * @param key sort key; meaningful only when {@code action} is {@link Action#ACCEPT}
 * @param action what the merge should do with the record
 * @param cause caller-supplied reason for {@link Action#STOP}; {@code null} otherwise
 * @since 0.1.0
 */
public record Extraction(long key, Action action, Exception cause) {
  private static final Extraction SKIP = new Extraction(0L, Action.SKIP, null);

  /**
   * Validates the action.
   */
  public Extraction {
    Objects.requireNonNull(action, "action");
  }

  /**
   * Accepts the record under {@code key}.
   *
   * @param key sort key (typically epoch seconds or millis)
   * @return accepting extraction
   */
  public static Extraction accept(long key) {
    return new Extraction(key, Action.ACCEPT, null);
  }

  /**
   * Skips the record.
   *
   * @return shared skipping extraction
   */
  public static Extraction skip() {
    return SKIP;
  }

  /**
   * Stops the source with the given cause.
   *
   * @param cause reason surfaced to the caller; may be {@code null}
   * @return stopping extraction
   */
  public static Extraction stop(Exception cause) {
    return new Extraction(0L, Action.STOP, cause);
  }
}
