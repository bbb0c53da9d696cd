package ca.gc.cra.logmerge.e2e;

import ca.gc.cra.logmerge.api.ExitCode;
import ca.gc.cra.logmerge.api.Main;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Runs the merge command over the fixture logs in both modes and checks the merged output.
 */
class MergeEndToEndTest {
  private static final List<String> FIXTURES = List.of("web-1.log", "web-2.log", "worker.log");
  private static final Method MAIN_RUN = locateMainRun();

  @TempDir Path tempDir;

  @Test
  void orderedMergeOfFixtureLogs() throws Exception {
    List<Path> sources = copyFixtures(false);
    Path out = tempDir.resolve("out/merged.log");

    ExitCode code = runMerge(
        "merge",
        "in=" + join(sources),
        "out=" + out,
        "--tag-source",
        "metricsExporter=none");

    assertSuccess("ordered merge", code);
    Assertions.assertEquals(List.of(
        "[web-1.log] 2024-05-01 09:00:00 web-1 INFO GET /orders 200",
        "[web-2.log] 2024-05-01 09:00:01 web-2 INFO POST /orders 201",
        "[web-1.log] 2024-05-01 09:00:02 web-1 INFO GET /orders/17 200",
        "[web-1.log] 2024-05-01 09:00:02 web-1 WARN slow response 1800ms",
        "[web-2.log] 2024-05-01 09:00:02 web-2 INFO GET /orders 200",
        "[worker.log] 2024-05-01 09:00:03 worker INFO settled batch 42",
        "[web-2.log] 2024-05-01 09:00:04 web-2 ERROR payment gateway timeout",
        "[web-1.log] 2024-05-01 09:00:05 web-1 INFO GET /health 200",
        "[web-2.log] 2024-05-01 09:00:06 web-2 INFO GET /health 200",
        "[worker.log] 2024-05-01 09:00:07 worker INFO settled batch 43"),
        Files.readAllLines(out, StandardCharsets.UTF_8));
  }

  @Test
  void concurrentMergeOfCompressedFixtureLogs() throws Exception {
    List<Path> sources = copyFixtures(true);
    Path out = tempDir.resolve("merged.log");

    ExitCode code = runMerge(
        "merge",
        "in=" + join(sources),
        "out=" + out,
        "mode=CONCURRENT",
        "workers=3",
        "inGzip=true",
        "exclude=/health",
        "--delete-sources",
        "metricsExporter=none");

    assertSuccess("concurrent merge", code);
    List<String> expected = new ArrayList<>();
    for (String fixture : FIXTURES) {
      for (String line : Files.readAllLines(resource(fixture), StandardCharsets.UTF_8)) {
        if (!line.contains("/health")) {
          expected.add(line);
        }
      }
    }
    List<String> actual = new ArrayList<>(Files.readAllLines(out, StandardCharsets.UTF_8));
    Collections.sort(expected);
    Collections.sort(actual);
    Assertions.assertEquals(expected, actual);
    for (Path source : sources) {
      Assertions.assertFalse(Files.exists(source), () -> "source not deleted: " + source);
    }
  }

  private List<Path> copyFixtures(boolean gzip) throws IOException {
    List<Path> copies = new ArrayList<>();
    for (String fixture : FIXTURES) {
      byte[] bytes = Files.readAllBytes(resource(fixture));
      if (gzip) {
        Path target = tempDir.resolve(fixture + ".gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
          out.write(bytes);
        }
        copies.add(target);
      } else {
        copies.add(Files.write(tempDir.resolve(fixture), bytes));
      }
    }
    return copies;
  }

  private static String join(List<Path> paths) {
    List<String> values = new ArrayList<>();
    for (Path path : paths) {
      values.add(path.toString());
    }
    return String.join(",", values);
  }

  private static Path resource(String name) {
    return Paths.get("src", "test", "resources", "fixtures", "logs").resolve(name);
  }

  private static Method locateMainRun() {
    try {
      Method method = Main.class.getDeclaredMethod("run", String[].class);
      method.setAccessible(true);
      return method;
    } catch (NoSuchMethodException ex) {
      throw new IllegalStateException("logmerge Main.run(String[]) method missing", ex);
    }
  }

  private static ExitCode runMerge(String... args) {
    try {
      return (ExitCode) MAIN_RUN.invoke(null, new Object[] {args});
    } catch (IllegalAccessException ex) {
      throw new IllegalStateException("Unable to access logmerge CLI entry point", ex);
    } catch (InvocationTargetException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("logmerge CLI execution failed", cause);
    }
  }

  private static void assertSuccess(String stage, ExitCode code) {
    Assertions.assertEquals(ExitCode.SUCCESS, code, () -> stage + " failed with exit code " + code);
  }
}
