package ca.gc.cra.logmerge.api;

import ca.gc.cra.logmerge.application.merge.CancellationSignal;
import ca.gc.cra.logmerge.application.merge.ConfigurationException;
import ca.gc.cra.logmerge.application.merge.DestinationException;
import ca.gc.cra.logmerge.application.merge.HandlerAbortException;
import ca.gc.cra.logmerge.application.merge.MergeJob;
import ca.gc.cra.logmerge.application.merge.MergeUseCase;
import ca.gc.cra.logmerge.application.merge.SourceAccessException;
import ca.gc.cra.logmerge.config.CompositionRoot;
import ca.gc.cra.logmerge.config.ConfigMerger;
import ca.gc.cra.logmerge.config.DefaultsForMode;
import ca.gc.cra.logmerge.config.MergeConfig;
import ca.gc.cra.logmerge.config.YamlConfigLoader;
import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.domain.merge.MergeReport;
import ca.gc.cra.logmerge.domain.merge.SourceFailure;
import ca.gc.cra.logmerge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logmerge.logging.LoggingConfigurator;
import ca.gc.cra.logmerge.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code merge} command: merges line-oriented log files into one destination.
 */
public final class MergeCli {
  private static final Logger log = LoggerFactory.getLogger(MergeCli.class);
  private static final String COMMAND = "merge";
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--dry-run", "dryRun",
      "--allow-overwrite", "allowOverwrite",
      "--delete-sources", "deleteSources",
      "--tag-source", "tagSource");
  private static final String SUMMARY_USAGE =
      "usage: merge in=PATH[,PATH...] out=PATH [mode=ORDERED|CONCURRENT] [workers=N] "
          + "[timeFormat=epoch|epochMillis|PATTERN] [inGzip=true] [outGzip=true] [--delete-sources] "
          + "[include=REGEX] [exclude=REGEX] [stopOn=REGEX] [--tag-source] [--dry-run] [--allow-overwrite] "
          + "[config=FILE]";
  private static final String HELP_TEXT = """
      logmerge merge

      Usage:
        merge in=a.log,b.log out=merged.log [options]

      Required:
        in=PATH[,PATH...]        Source files, merged in the order given (repeatable)
        out=PATH                 Destination file

      Merge:
        mode=ORDERED|CONCURRENT  ORDERED merges by timestamp (default); CONCURRENT drains
                                 sources in parallel with no ordering across sources
        workers=N                Worker threads (CONCURRENT only)
        queueCapacity=N          Records buffered between workers and writer (CONCURRENT only)
        timeFormat=FORMAT        epoch, epochMillis, or a java.time pattern matched at the start
                                 of each line (default yyyy-MM-dd HH:mm:ss)
        timeZone=ZONE            Zone for timestamps without an offset (default UTC)
        maxRecordBytes=N         Longest accepted line (default 65536)

      Filters:
        include=REGEX            Keep only lines containing a match
        exclude=REGEX            Drop lines containing a match
        stopOn=REGEX             Stop at the first matching line (ORDERED aborts the merge)
        --tag-source             Prefix each line with [source-file-name]

      Files:
        inGzip=true|false        Sources are gzip-compressed
        outGzip=true|false       Gzip the destination
        --delete-sources         Delete sources after a complete merge
        --allow-overwrite        Replace an existing destination
        --dry-run                Validate and print the plan without merging
        config=FILE              YAML file with common/merge sections (CLI wins)

      Telemetry:
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated resource attributes

        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private MergeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for merge CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    for (Map.Entry<String, String> flag : FLAG_KEYS.entrySet()) {
      if (input.hasFlag(flag.getKey())) {
        kv.put(flag.getValue(), "true");
      }
    }

    String configPath = kv.remove("config");
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, COMMAND);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    MergeConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          COMMAND, yamlConfig, kv, DefaultsForMode.asFlatMap(COMMAND), log::warn);
      config = MergeConfig.fromMap(effective);
      validatePaths(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid merge arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (config.verbose() && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.create(config.telemetry())) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      CancellationSignal cancel = new CancellationSignal();
      MergeJob job = root.mergeJob(cancel, new LoggingErrorSink());
      return execute(root.mergeUseCase(), job, cancel);
    }
  }

  private static ExitCode execute(MergeUseCase useCase, MergeJob job, CancellationSignal cancel) {
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = job.mode() == MergeMode.CONCURRENT ? installShutdownHook(cancel, finished) : null;
    try {
      MergeReport report = useCase.run(job);
      printSummary(job, report);
      if (report.cancelled()) {
        return ExitCode.INTERRUPTED;
      }
      return report.failures().isEmpty() ? ExitCode.SUCCESS : ExitCode.PARTIAL;
    } catch (ConfigurationException ex) {
      log.error("Merge configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (HandlerAbortException ex) {
      log.error("Merge stopped by {} on source {}: {}", ex.stage(), ex.sourceLabel().orElse("?"), causeMessage(ex));
      return ExitCode.ABORTED;
    } catch (SourceAccessException ex) {
      log.error("Merge failed reading source {}", ex.sourceLabel().orElse("?"), ex);
      return ExitCode.IO_ERROR;
    } catch (DestinationException ex) {
      log.error("Merge failed writing {}", job.destination(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Merge interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in merge", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in merge", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      if (hook != null) {
        removeShutdownHook(hook);
      }
    }
  }

  private static Thread installShutdownHook(CancellationSignal cancel, CountDownLatch finished) {
    Thread hook = new Thread(() -> {
      if (cancel.cancel()) {
        log.warn("Shutdown requested; cancelling merge");
      }
      try {
        if (!finished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Merge did not stop within {}s of shutdown request", SHUTDOWN_GRACE.toSeconds());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "merge-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; leaving merge shutdown hook in place");
    }
  }

  private static void validatePaths(MergeConfig config) {
    for (Path source : config.sources()) {
      Paths.validateReadableFile(source);
    }
    Paths.validateWritableFile(config.destination(), config.allowOverwrite());
  }

  private static void printDryRunPlan(MergeConfig config) {
    CliPrinter.printLines(
        "Merge dry-run: no files will be written or deleted.",
        " Sources           : " + config.sources().stream().map(Path::toString).collect(Collectors.joining(", ")),
        " Destination       : " + config.destination(),
        " Mode              : " + config.mode()
            + (config.mode() == MergeMode.CONCURRENT
                ? " (workers=" + config.workers() + ", queueCapacity=" + config.queueCapacity() + ")"
                : ""),
        " Time format       : " + config.timeFormat() + " (" + config.timeZone().getId() + ")",
        " Include / exclude : " + config.include().map(Object::toString).orElse("<none>")
            + " / " + config.exclude().map(Object::toString).orElse("<none>"),
        " Stop on           : " + config.stopOn().map(Object::toString).orElse("<none>"),
        " Tag source        : " + config.tagSource(),
        " Gzip in / out     : " + config.sourceGzip() + " / " + config.destinationGzip(),
        " Delete sources    : " + config.deleteSources(),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Metrics exporter  : " + config.telemetry().exporter(),
        " Re-run without --dry-run to merge.");
  }

  private static void printSummary(MergeJob job, MergeReport report) {
    CliPrinter.println("Merged " + report.recordsWritten() + " records into " + job.destination()
        + " (" + report.recordsSkipped() + " skipped)");
    for (SourceFailure failure : report.failures()) {
      CliPrinter.println(" failed: " + failure.sourceLabel() + ": " + failure.cause().getMessage());
    }
    if (report.cancelled()) {
      CliPrinter.println(" cancelled before every source was drained; sources kept");
    }
  }

  private static String causeMessage(HandlerAbortException ex) {
    Throwable cause = ex.getCause();
    return cause == null || cause.getMessage() == null ? "no reason given" : cause.getMessage();
  }
}
