package ca.gc.cra.logmerge.config;

import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.infrastructure.io.LineRecordSource;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened default configuration per CLI command.
 *
 * <p>Every optional key has an entry here, so YAML files and CLI arguments only need to name what
 * they change.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code command} merged over the common defaults.
   *
   * @param command CLI command (currently only {@code merge})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (command.trim().toLowerCase(Locale.ROOT)) {
      case "merge" -> buildMergeDefaults();
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildMergeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("mode", MergeMode.ORDERED.name());
    map.put("workers", "");
    map.put("queueCapacity", "");
    map.put("inGzip", "false");
    map.put("outGzip", "false");
    map.put("deleteSources", "false");
    map.put("timeFormat", MergeConfig.DEFAULT_TIME_FORMAT);
    map.put("timeZone", MergeConfig.DEFAULT_TIME_ZONE.getId());
    map.put("include", "");
    map.put("exclude", "");
    map.put("stopOn", "");
    map.put("tagSource", "false");
    map.put("maxRecordBytes", Integer.toString(LineRecordSource.DEFAULT_MAX_RECORD_BYTES));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
