package ca.gc.cra.logmerge.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Resolved OpenTelemetry exporter settings.
 *
 * <p>Each value comes from the merge configuration when set, otherwise from the standard
 * {@code OTEL_*} environment variables, otherwise from a built-in default.</p>
 *
 * @param exporter exporter to install
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes extra {@code key=value} resource attributes, comma separated; may be empty
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** Settings that install no exporter. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, null, null);
  }

  /**
   * Resolves settings, falling back to the environment for blank values.
   *
   * @param exporter {@code otlp}, {@code none}, or blank
   * @param endpoint endpoint URI or blank
   * @param resourceAttributes attribute list or blank
   * @return resolved settings
   * @throws IllegalArgumentException if {@code exporter} names an unknown exporter
   */
  public static TelemetrySettings resolve(String exporter, String endpoint, String resourceAttributes) {
    return new TelemetrySettings(
        Exporter.from(firstNonBlank(exporter, System.getenv("OTEL_METRICS_EXPORTER"))),
        firstNonBlank(endpoint, System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT")),
        firstNonBlank(resourceAttributes, System.getenv("OTEL_RESOURCE_ATTRIBUTES")));
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    return second;
  }

  /** Supported metric exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name; blank means {@link #NONE}.
     *
     * @throws IllegalArgumentException for names other than {@code otlp} and {@code none}
     */
    public static Exporter from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was " + raw + ")");
      };
    }
  }
}
