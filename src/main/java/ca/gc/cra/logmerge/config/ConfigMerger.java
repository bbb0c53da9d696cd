package ca.gc.cra.logmerge.config;

import ca.gc.cra.logmerge.domain.merge.MergeMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings with precedence CLI &gt; YAML &gt; defaults, then checks
 * cross-key rules.
 */
public final class ConfigMerger {
  private static final Set<String> CONCURRENT_ONLY_KEYS = Set.of("workers", "queueCapacity");

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives a message for each CLI key overriding a YAML key
   * @return immutable merged map
   * @throws IllegalArgumentException when a cross-key rule fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    if ("merge".equalsIgnoreCase(command)) {
      validateMerge(merged, yamlCopy, cliCopy);
    }
    return Map.copyOf(merged);
  }

  private static void validateMerge(
      Map<String, String> effective, Map<String, String> yaml, Map<String, String> cli) {
    MergeMode mode = MergeMode.fromString(effective.get("mode"));
    if (mode == MergeMode.ORDERED) {
      for (String key : CONCURRENT_ONLY_KEYS) {
        if (isSet(cli, key) || isSet(yaml, key)) {
          throw new IllegalArgumentException(key + " only applies to mode=CONCURRENT");
        }
      }
    }
  }

  private static boolean isSet(Map<String, String> map, String key) {
    String value = map.get(key);
    return value != null && !value.isBlank();
  }
}
