package ca.gc.cra.logmerge.api;

import ca.gc.cra.logmerge.validation.Strings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts {@code key=value} arguments into a map.
 *
 * <p>List-valued keys ({@code in}) may be repeated; repeated values are joined with commas in
 * argument order, so {@code in=a.log in=b.log} equals {@code in=a.log,b.log}. Repeating any other
 * key is an error.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");
  private static final Set<String> LIST_KEYS = Set.of("in");

  private CliArgsParser() {}

  /**
   * Parses {@code args}.
   *
   * @param args arguments of the form {@code key=value}
   * @return ordered, mutable map of arguments
   * @throws IllegalArgumentException when an argument is malformed or repeated
   */
  public static Map<String, String> toMap(List<String> args) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String raw : args) {
      int idx = raw.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = raw.substring(0, idx).trim();
      String value = raw.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.isEmpty()) {
        throw new IllegalArgumentException("argument " + key + " must have a value");
      }
      value = Strings.requireNonBlank(key, value);
      String previous = map.get(key);
      if (previous == null) {
        map.put(key, value);
      } else if (LIST_KEYS.contains(key)) {
        map.put(key, previous + "," + value);
      } else {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }
}
