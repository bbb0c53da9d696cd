package ca.gc.cra.logmerge.infrastructure.filter;

import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.domain.merge.Action;
import ca.gc.cra.logmerge.domain.merge.FilterResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stock {@link RecordFilter}s. Patterns are matched with {@link java.util.regex.Matcher#find()}
 * against the record decoded as UTF-8.
 *
 * @since 0.1.0
 */
public final class RecordFilters {
  private RecordFilters() {
    // Utility
  }

  /** Keeps only records containing a match of {@code pattern}. */
  public static RecordFilter include(Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return (label, record) -> matches(pattern, record) ? FilterResult.accept(record) : FilterResult.skip();
  }

  /** Drops records containing a match of {@code pattern}. */
  public static RecordFilter exclude(Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return (label, record) -> matches(pattern, record) ? FilterResult.skip() : FilterResult.accept(record);
  }

  /**
   * Stops the source at the first record containing a match of {@code pattern}. The matching record
   * is not emitted.
   */
  public static RecordFilter stopOn(Pattern pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return (label, record) -> {
      if (!matches(pattern, record)) {
        return FilterResult.accept(record);
      }
      return FilterResult.stop(new StopPatternMatchedException(label, pattern));
    };
  }

  /** Prefixes each record with {@code [label] }. */
  public static RecordFilter tagSource() {
    return (label, record) -> {
      byte[] tag = ("[" + label + "] ").getBytes(StandardCharsets.UTF_8);
      byte[] out = new byte[tag.length + record.length];
      System.arraycopy(tag, 0, out, 0, tag.length);
      System.arraycopy(record, 0, out, tag.length, record.length);
      return FilterResult.accept(out);
    };
  }

  /**
   * Applies {@code filters} left to right, feeding each one the bytes the previous one accepted.
   * The first skip or stop wins.
   *
   * @param filters filters to chain; an empty list accepts every record unchanged
   * @return chained filter
   */
  public static RecordFilter chain(List<RecordFilter> filters) {
    List<RecordFilter> steps = List.copyOf(filters);
    if (steps.size() == 1) {
      return steps.get(0);
    }
    return (label, record) -> {
      byte[] current = record;
      for (RecordFilter step : steps) {
        FilterResult result = step.filter(label, current);
        if (result.action() != Action.ACCEPT) {
          return result;
        }
        current = result.record();
      }
      return FilterResult.accept(current);
    };
  }

  private static boolean matches(Pattern pattern, byte[] record) {
    return pattern.matcher(new String(record, StandardCharsets.UTF_8)).find();
  }

  /** Cause attached to {@link FilterResult#stop(Exception)} by {@link #stopOn(Pattern)}. */
  public static final class StopPatternMatchedException extends Exception {
    private static final long serialVersionUID = 1L;

    StopPatternMatchedException(String label, Pattern pattern) {
      super("Record in " + label + " matched stop pattern /" + pattern.pattern() + "/");
    }
  }
}
