package ca.gc.cra.logmerge.config;

import ca.gc.cra.logmerge.application.merge.CancellationSignal;
import ca.gc.cra.logmerge.application.merge.MergeJob;
import ca.gc.cra.logmerge.application.merge.MergeUseCase;
import ca.gc.cra.logmerge.application.port.MergeErrorSink;
import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.infrastructure.filter.RecordFilters;
import ca.gc.cra.logmerge.infrastructure.io.FileSinkOpener;
import ca.gc.cra.logmerge.infrastructure.io.FileSourceOpener;
import ca.gc.cra.logmerge.infrastructure.io.FileSourceRemover;
import ca.gc.cra.logmerge.infrastructure.time.TimeExtractors;
import ca.gc.cra.logmerge.infrastructure.time.TimestampPrefixExtractor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wires a {@link MergeConfig} to file-backed collaborators and strategies.
 */
public final class CompositionRoot {
  private final MergeConfig config;
  private final MetricsPort metrics;

  public CompositionRoot(MergeConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public MergeUseCase mergeUseCase() {
    return new MergeUseCase(
        new FileSourceOpener(config.sourceGzip(), config.maxRecordBytes()),
        new FileSinkOpener(config.destinationGzip()),
        new FileSourceRemover(),
        metrics);
  }

  /**
   * Builds the job for this configuration.
   *
   * @param cancel cancellation signal fired by the CLI shutdown hook
   * @param errorSink receives per-source failures in concurrent mode
   * @return job ready for {@link MergeUseCase#run(MergeJob)}
   */
  public MergeJob mergeJob(CancellationSignal cancel, MergeErrorSink errorSink) {
    List<String> sources = new ArrayList<>(config.sources().size());
    for (Path source : config.sources()) {
      sources.add(source.toString());
    }
    return MergeJob.builder()
        .sources(sources)
        .destination(config.destination().toString())
        .timeExtractor(timeExtractor())
        .filter(recordFilter())
        .mode(config.mode())
        .workers(config.workers())
        .queueCapacity(config.queueCapacity())
        .cancel(cancel)
        .errorSink(errorSink)
        .deleteSources(config.deleteSources())
        .build();
  }

  TimeExtractor timeExtractor() {
    return switch (config.timeFormat()) {
      case MergeConfig.EPOCH -> TimeExtractors.epochSeconds();
      case MergeConfig.EPOCH_MILLIS -> TimeExtractors.epochMillis();
      default -> new TimestampPrefixExtractor(config.timeFormat(), config.timeZone(), metrics);
    };
  }

  /** Returns the configured filter chain, or {@code null} when no filter applies. */
  RecordFilter recordFilter() {
    List<RecordFilter> filters = new ArrayList<>();
    config.stopOn().ifPresent(pattern -> filters.add(RecordFilters.stopOn(pattern)));
    config.include().ifPresent(pattern -> filters.add(RecordFilters.include(pattern)));
    config.exclude().ifPresent(pattern -> filters.add(RecordFilters.exclude(pattern)));
    if (config.tagSource()) {
      filters.add(RecordFilters.tagSource());
    }
    return filters.isEmpty() ? null : RecordFilters.chain(filters);
  }
}
