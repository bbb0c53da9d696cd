package ca.gc.cra.logmerge.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits raw CLI arguments into {@code key=value} arguments and bare flags.
 *
 * <p>Flags are lower-cased; aliases such as {@code -h} and {@code -v} are folded into their long
 * form. Arguments keep their original order.</p>
 *
 * @param keyValueArgs arguments that are not flags, in order
 * @param flags normalized flags
 * @since 0.1.0
 */
public record CliInput(List<String> keyValueArgs, Set<String> flags) {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "-n", "--dry-run");

  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    flags = Set.copyOf(flags);
  }

  /**
   * Parses {@code args}; {@code null} and blank entries are ignored.
   *
   * @param args raw arguments, possibly {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (ALIASES.containsKey(lower)) {
          flags.add(ALIASES.get(lower));
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, flags);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Reports whether {@code flag} was given, ignoring case.
   *
   * @param flag flag including its dashes, e.g. {@code --dry-run}
   * @return {@code true} when present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
