package ca.gc.cra.logmerge.application.merge;

import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.application.port.RecordSink;
import ca.gc.cra.logmerge.application.port.RecordSource;
import ca.gc.cra.logmerge.application.port.SinkOpener;
import ca.gc.cra.logmerge.application.port.SourceOpener;
import ca.gc.cra.logmerge.application.port.SourceRemover;
import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.domain.merge.MergeReport;
import ca.gc.cra.logmerge.domain.merge.SourceFailure;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs a {@link MergeJob}: validates it, opens sources and destination, drives the ordered merger or
 * the worker pool, closes every stream, and removes sources after a complete run.
 *
 * <p>Ordered jobs open every source before creating the destination and fail on the first source
 * that cannot be opened. Concurrent jobs create the destination first (a failure there aborts the
 * job before any worker starts) and report unopenable sources on the job's error sink.</p>
 *
 * <p>Streams are closed on every exit path. The destination is closed before sources are removed,
 * so a compressed destination is complete on disk before its inputs disappear.</p>
 *
 * @since 0.1.0
 */
public final class MergeUseCase {
  private static final Logger log = LoggerFactory.getLogger(MergeUseCase.class);

  private final SourceOpener sourceOpener;
  private final SinkOpener sinkOpener;
  private final SourceRemover sourceRemover;
  private final MetricsPort metrics;

  /**
   * Wires the use case to its stream and path collaborators.
   *
   * @param sourceOpener opens (and decompresses) sources
   * @param sinkOpener creates (and compresses) the destination
   * @param sourceRemover deletes sources after a complete run
   * @param metrics metrics sink shared with the mergers
   */
  public MergeUseCase(
      SourceOpener sourceOpener, SinkOpener sinkOpener, SourceRemover sourceRemover, MetricsPort metrics) {
    this.sourceOpener = Objects.requireNonNull(sourceOpener, "sourceOpener");
    this.sinkOpener = Objects.requireNonNull(sinkOpener, "sinkOpener");
    this.sourceRemover = Objects.requireNonNull(sourceRemover, "sourceRemover");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Executes the job.
   *
   * @param job job description
   * @return report of the run
   * @throws ConfigurationException if the job is missing a required strategy or channel
   * @throws SourceAccessException if an ordered job cannot open or read a source, or a source cannot be removed
   * @throws HandlerAbortException if a strategy stopped an ordered job
   * @throws DestinationException if the destination cannot be created, written, or closed
   * @throws InterruptedException if a concurrent job is interrupted
   */
  public MergeReport run(MergeJob job) throws MergeException, InterruptedException {
    Objects.requireNonNull(job, "job");
    validate(job);
    String pipeline = job.mode() == MergeMode.ORDERED ? "merge-ordered" : "merge-concurrent";
    MDC.put("pipeline", pipeline);
    try {
      log.info("Merging {} sources into {} ({})", job.sources().size(), job.destination(), job.mode());
      MergeReport report = job.mode() == MergeMode.ORDERED ? runOrdered(job) : runConcurrent(job);
      log.info("Merge wrote {} records ({} skipped, {} failed sources{})",
          report.recordsWritten(),
          report.recordsSkipped(),
          report.failures().size(),
          report.cancelled() ? ", cancelled" : "");
      if (job.deleteSources()) {
        removeSources(job, report);
      }
      return report;
    } finally {
      MDC.remove("pipeline");
    }
  }

  private static void validate(MergeJob job) throws ConfigurationException {
    if (job.timeExtractor() == null) {
      throw new ConfigurationException("time extractor is required");
    }
    if (job.destination() == null || job.destination().isBlank()) {
      throw new ConfigurationException("destination is required");
    }
    if (job.mode() == MergeMode.CONCURRENT) {
      if (job.errorSink() == null) {
        throw new ConfigurationException("error sink is required for concurrent merges");
      }
      if (job.workers() <= 0) {
        throw new ConfigurationException("workers must be positive (was " + job.workers() + ")");
      }
      if (job.queueCapacity() <= 0) {
        throw new ConfigurationException("queueCapacity must be positive (was " + job.queueCapacity() + ")");
      }
    }
  }

  private MergeReport runOrdered(MergeJob job) throws MergeException {
    List<RecordSource> sources = new ArrayList<>(job.sources().size());
    RecordSink sink = null;
    MergeException primary = null;
    try {
      for (String location : job.sources()) {
        sources.add(open(location));
      }
      sink = create(job.destination());
      return new OrderedMerger(metrics).run(sources, sink, job.timeExtractor(), job.filter());
    } catch (MergeException ex) {
      primary = ex;
      throw ex;
    } finally {
      closeAll(sink, sources, primary);
    }
  }

  private MergeReport runConcurrent(MergeJob job) throws MergeException, InterruptedException {
    RecordSink sink = create(job.destination());
    List<RecordSource> sources = new ArrayList<>(job.sources().size());
    List<SourceFailure> openFailures = new ArrayList<>();
    MergeException primary = null;
    try {
      for (String location : job.sources()) {
        try {
          sources.add(open(location));
        } catch (SourceAccessException ex) {
          SourceFailure failure = new SourceFailure(location, ex);
          openFailures.add(failure);
          metrics.increment("merge.concurrent.source.failed");
          try {
            job.errorSink().report(failure);
          } catch (RuntimeException reportFailure) {
            log.error("Error sink rejected failure report for source {}", location, reportFailure);
          }
        }
      }
      UnorderedWorkerPool pool = new UnorderedWorkerPool(job.queueCapacity(), metrics);
      MergeReport report = pool.run(sources, sink, job.filter(), job.workers(), job.cancel(), job.errorSink());
      if (openFailures.isEmpty()) {
        return report;
      }
      List<SourceFailure> failures = new ArrayList<>(openFailures);
      failures.addAll(report.failures());
      return new MergeReport(
          report.mode(), report.recordsWritten(), report.recordsSkipped(), failures, report.cancelled());
    } catch (MergeException ex) {
      primary = ex;
      throw ex;
    } finally {
      closeAll(sink, sources, primary);
    }
  }

  private RecordSource open(String location) throws SourceAccessException {
    try {
      return sourceOpener.open(location);
    } catch (IOException ex) {
      throw new SourceAccessException(location, ex);
    }
  }

  private RecordSink create(String location) throws DestinationException {
    try {
      return sinkOpener.open(location);
    } catch (IOException ex) {
      throw new DestinationException("Unable to create destination " + location, ex);
    }
  }

  private void closeAll(RecordSink sink, List<RecordSource> sources, MergeException primary)
      throws DestinationException {
    for (RecordSource source : sources) {
      try {
        source.close();
      } catch (IOException ex) {
        log.warn("Failed to close source {}", source.label(), ex);
        if (primary != null) {
          primary.addSuppressed(ex);
        }
      }
    }
    if (sink == null) {
      return;
    }
    try {
      sink.close();
    } catch (IOException ex) {
      if (primary != null) {
        log.warn("Failed to close destination after merge failure", ex);
        primary.addSuppressed(ex);
        return;
      }
      throw new DestinationException("Failed to close destination", ex);
    }
  }

  private void removeSources(MergeJob job, MergeReport report) throws SourceAccessException {
    if (!report.complete()) {
      log.warn("Keeping sources because the merge did not complete cleanly");
      return;
    }
    try {
      sourceRemover.remove(job.sources());
      log.info("Removed {} merged sources", job.sources().size());
    } catch (IOException ex) {
      throw new SourceAccessException(String.join(",", job.sources()), ex);
    }
  }
}
