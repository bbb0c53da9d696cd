package ca.gc.cra.logmerge.config;

import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.infrastructure.io.LineRecordSource;
import ca.gc.cra.logmerge.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.logmerge.validation.Numbers;
import ca.gc.cra.logmerge.validation.Paths;
import ca.gc.cra.logmerge.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Typed, validated settings of the {@code merge} command.
 *
 * @param sources source files in merge order
 * @param destination destination file
 * @param sourceGzip whether sources are gzip-compressed
 * @param destinationGzip whether to gzip the destination
 * @param deleteSources whether to delete sources after a complete run
 * @param mode ordered or concurrent draining
 * @param workers worker threads (concurrent)
 * @param queueCapacity hand-off capacity (concurrent)
 * @param timeFormat {@value #EPOCH}, {@value #EPOCH_MILLIS}, or a {@link DateTimeFormatter} pattern
 * @param timeZone zone for timestamps without an offset
 * @param include optional pattern a record must contain
 * @param exclude optional pattern a record must not contain
 * @param stopOn optional pattern that stops a source
 * @param tagSource whether to prefix records with their source label
 * @param maxRecordBytes longest accepted line
 * @param allowOverwrite whether an existing destination may be replaced
 * @param dryRun whether to print the plan without merging
 * @param verbose whether DEBUG logging was requested
 * @param telemetry metrics exporter settings
 */
public record MergeConfig(
    List<Path> sources,
    Path destination,
    boolean sourceGzip,
    boolean destinationGzip,
    boolean deleteSources,
    MergeMode mode,
    int workers,
    int queueCapacity,
    String timeFormat,
    ZoneId timeZone,
    Optional<Pattern> include,
    Optional<Pattern> exclude,
    Optional<Pattern> stopOn,
    boolean tagSource,
    int maxRecordBytes,
    boolean allowOverwrite,
    boolean dryRun,
    boolean verbose,
    TelemetrySettings telemetry) {

  public static final String EPOCH = "epoch";
  public static final String EPOCH_MILLIS = "epochMillis";
  public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd HH:mm:ss";
  public static final ZoneId DEFAULT_TIME_ZONE = ZoneId.of("UTC");
  public static final int DEFAULT_WORKERS = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
  public static final int MAX_WORKERS = 256;
  public static final int MAX_QUEUE_CAPACITY = 1_000_000;
  public static final int MAX_RECORD_BYTES_LIMIT = 64 * 1024 * 1024;

  private static final int QUEUE_CAPACITY_PER_WORKER = 128;
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  public MergeConfig {
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("at least one source is required");
    }
    Objects.requireNonNull(destination, "destination");
    mode = Objects.requireNonNullElse(mode, MergeMode.ORDERED);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange("maxRecordBytes", maxRecordBytes, 1, MAX_RECORD_BYTES_LIMIT);
    timeFormat = validateTimeFormat(timeFormat);
    timeZone = Objects.requireNonNullElse(timeZone, DEFAULT_TIME_ZONE);
    include = Objects.requireNonNullElse(include, Optional.empty());
    exclude = Objects.requireNonNullElse(exclude, Optional.empty());
    stopOn = Objects.requireNonNullElse(stopOn, Optional.empty());
    telemetry = Objects.requireNonNullElse(telemetry, TelemetrySettings.disabled());
    Paths.requireDistinct(destination, sources);
  }

  /**
   * Builds a config from a flattened key/value map (see {@link DefaultsForMode}).
   *
   * @param options effective configuration
   * @return validated config
   * @throws IllegalArgumentException when a value is missing or invalid
   */
  public static MergeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    List<Path> sources = new ArrayList<>();
    for (String entry : Strings.requireList("in", required(options, "in"))) {
      sources.add(Paths.parse("in", entry));
    }
    Path destination = Paths.parse("out", required(options, "out"));

    MergeMode mode = MergeMode.fromString(options.get("mode"));
    int workers = isBlank(options.get("workers"))
        ? DEFAULT_WORKERS
        : Numbers.parseInt("workers", options.get("workers"), 1, MAX_WORKERS);
    int queueCapacity = isBlank(options.get("queueCapacity"))
        ? Math.min(MAX_QUEUE_CAPACITY, workers * QUEUE_CAPACITY_PER_WORKER)
        : Numbers.parseInt("queueCapacity", options.get("queueCapacity"), 1, MAX_QUEUE_CAPACITY);
    int maxRecordBytes = isBlank(options.get("maxRecordBytes"))
        ? LineRecordSource.DEFAULT_MAX_RECORD_BYTES
        : Numbers.parseInt("maxRecordBytes", options.get("maxRecordBytes"), 1, MAX_RECORD_BYTES_LIMIT);

    String timeFormat = isBlank(options.get("timeFormat")) ? DEFAULT_TIME_FORMAT : options.get("timeFormat");
    ZoneId zone = parseZone(options.get("timeZone"));

    return new MergeConfig(
        sources,
        destination,
        Numbers.parseBoolean("inGzip", options.get("inGzip"), false),
        Numbers.parseBoolean("outGzip", options.get("outGzip"), false),
        Numbers.parseBoolean("deleteSources", options.get("deleteSources"), false),
        mode,
        workers,
        queueCapacity,
        timeFormat,
        zone,
        optionalPattern("include", options.get("include")),
        optionalPattern("exclude", options.get("exclude")),
        optionalPattern("stopOn", options.get("stopOn")),
        Numbers.parseBoolean("tagSource", options.get("tagSource"), false),
        maxRecordBytes,
        Numbers.parseBoolean("allowOverwrite", options.get("allowOverwrite"), false),
        Numbers.parseBoolean("dryRun", options.get("dryRun"), false),
        Numbers.parseBoolean("verbose", options.get("verbose"), false),
        telemetry(options));
  }

  private static String validateTimeFormat(String raw) {
    String format = Strings.requireNonBlank("timeFormat", raw);
    if (format.equals(EPOCH) || format.equals(EPOCH_MILLIS)) {
      return format;
    }
    try {
      DateTimeFormatter.ofPattern(format);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("timeFormat is not a valid date-time pattern: " + format, ex);
    }
    return format;
  }

  private static ZoneId parseZone(String raw) {
    if (isBlank(raw)) {
      return DEFAULT_TIME_ZONE;
    }
    try {
      return ZoneId.of(raw.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("timeZone is not a valid zone id: " + raw, ex);
    }
  }

  private static Optional<Pattern> optionalPattern(String name, String raw) {
    return isBlank(raw) ? Optional.empty() : Optional.of(Strings.requirePattern(name, raw));
  }

  private static TelemetrySettings telemetry(Map<String, String> options) {
    String endpoint = options.get("otelEndpoint");
    if (!isBlank(endpoint)) {
      validateEndpoint(endpoint.trim());
    }
    String attributes = options.get("otelResourceAttributes");
    if (!isBlank(attributes)) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return TelemetrySettings.resolve(options.get("metricsExporter"), endpoint, attributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (isBlank(value)) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
