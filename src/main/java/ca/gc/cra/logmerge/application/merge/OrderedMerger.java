package ca.gc.cra.logmerge.application.merge;

import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.application.port.RecordSink;
import ca.gc.cra.logmerge.application.port.RecordSource;
import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.domain.merge.MergeReport;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded k-way merge producing globally time-ordered output.
 *
 * <p>Every source is primed once, then the cursor with the smallest key is written, flushed, and
 * advanced until the frontier drains. Each record is flushed before the next one is read, so when a
 * run fails the destination holds exactly the records emitted before the failing record.</p>
 *
 * <p>For sources whose keys are individually non-decreasing the output is globally non-decreasing;
 * ties are emitted in source order. Sources and the destination are owned by the caller.</p>
 *
 * @since 0.1.0
 */
public final class OrderedMerger {
  private static final Logger log = LoggerFactory.getLogger(OrderedMerger.class);

  private final MetricsPort metrics;

  public OrderedMerger() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a merger reporting to the given metrics port.
   *
   * @param metrics metrics sink for written/skipped counters
   */
  public OrderedMerger(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Merges {@code sources} into {@code destination}.
   *
   * @param sources open sources in job order; order defines the tie-break for equal keys
   * @param destination open sink receiving every accepted record
   * @param timeExtractor required time-extraction strategy
   * @param filter optional filter strategy; may be {@code null}
   * @return report of the completed run
   * @throws ConfigurationException if {@code timeExtractor} is missing
   * @throws HandlerAbortException if a strategy stopped a source; output holds the records flushed so far
   * @throws SourceAccessException if a source cannot be read
   * @throws DestinationException if the destination cannot be written or flushed
   */
  public MergeReport run(
      List<? extends RecordSource> sources,
      RecordSink destination,
      TimeExtractor timeExtractor,
      RecordFilter filter) throws MergeException {
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(destination, "destination");
    if (timeExtractor == null) {
      throw new ConfigurationException("time extractor is required");
    }

    List<RecordCursor> cursors = new ArrayList<>(sources.size());
    PriorityFrontier frontier = new PriorityFrontier(sources.size());
    for (int i = 0; i < sources.size(); i++) {
      RecordCursor cursor = new RecordCursor(sources.get(i), i, timeExtractor, filter);
      cursors.add(cursor);
      cursor.advance();
      if (cursor.exhausted()) {
        log.debug("Source {} has no accepted records", cursor.label());
      }
    }
    for (RecordCursor cursor : cursors) {
      if (!cursor.exhausted()) {
        frontier.insert(cursor);
      }
    }
    metrics.observe("merge.frontier.size", frontier.size());
    log.debug("Ordered merge primed {} of {} sources", frontier.size(), sources.size());

    long written = 0;
    while (!frontier.isEmpty()) {
      RecordCursor next = frontier.extractMin();
      emit(destination, next);
      written++;
      metrics.increment("merge.ordered.records.written");

      next.advance();
      if (next.exhausted()) {
        log.debug("Source {} exhausted after {} records written overall", next.label(), written);
      } else {
        frontier.insert(next);
      }
    }

    long skipped = 0;
    for (RecordCursor cursor : cursors) {
      skipped += cursor.skipped();
    }
    if (skipped > 0) {
      metrics.observe("merge.ordered.records.skipped", skipped);
    }
    return new MergeReport(MergeMode.ORDERED, written, skipped, List.of(), false);
  }

  private static void emit(RecordSink destination, RecordCursor cursor) throws DestinationException {
    try {
      destination.write(cursor.record());
      destination.flush();
    } catch (IOException ex) {
      throw new DestinationException("Failed to write record from " + cursor.label(), ex);
    }
  }
}
