package ca.gc.cra.logmerge.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.logmerge.infrastructure.metrics.TelemetrySettings.Exporter;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {

  @Test
  void exporterNamesAreCaseInsensitive() {
    assertEquals(Exporter.OTLP, Exporter.from("OTLP"));
    assertEquals(Exporter.NONE, Exporter.from(" none "));
    assertEquals(Exporter.NONE, Exporter.from(""));
    assertEquals(Exporter.NONE, Exporter.from(null));
  }

  @Test
  void unknownExporterIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Exporter.from("prometheus"));
    assertEquals("metricsExporter must be 'otlp' or 'none' (was prometheus)", ex.getMessage());
  }

  @Test
  void explicitValuesWinOverEnvironment() {
    TelemetrySettings settings = TelemetrySettings.resolve("otlp", "http://collector:4317", "team=ops");

    assertEquals(Exporter.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("team=ops", settings.resourceAttributes());
  }

  @Test
  void disabledUsesDefaults() {
    TelemetrySettings settings = TelemetrySettings.disabled();

    assertEquals(Exporter.NONE, settings.exporter());
    assertEquals("http://localhost:4317", settings.endpoint());
    assertEquals("", settings.resourceAttributes());
  }
}
