package ca.gc.cra.logmerge.application.merge;

import ca.gc.cra.logmerge.application.port.MergeErrorSink;
import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.domain.merge.MergeMode;
import java.util.List;
import java.util.Objects;

/**
 * Everything a single merge run needs besides its collaborators.
 *
 * <p>The record does not reject a missing time extractor or error sink itself; {@link MergeUseCase}
 * reports those as {@link ConfigurationException}s before touching any source.</p>
 *
 * @param sources source locations in job order
 * @param destination destination location
 * @param timeExtractor required time-extraction strategy
 * @param filter optional filter strategy; {@code null} when absent
 * @param mode ordered or concurrent draining
 * @param workers worker count (concurrent only)
 * @param queueCapacity hand-off capacity (concurrent only)
 * @param cancel cancellation signal (concurrent only); {@code null} when not cancellable
 * @param errorSink per-source failure channel (required for concurrent)
 * @param deleteSources whether to remove sources after a complete run
 * @since 0.1.0
 */
public record MergeJob(
    List<String> sources,
    String destination,
    TimeExtractor timeExtractor,
    RecordFilter filter,
    MergeMode mode,
    int workers,
    int queueCapacity,
    CancellationSignal cancel,
    MergeErrorSink errorSink,
    boolean deleteSources) {

  public MergeJob {
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    mode = Objects.requireNonNullElse(mode, MergeMode.ORDERED);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Fluent builder with ordered-mode defaults. */
  public static final class Builder {
    private List<String> sources = List.of();
    private String destination;
    private TimeExtractor timeExtractor;
    private RecordFilter filter;
    private MergeMode mode = MergeMode.ORDERED;
    private int workers = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    private int queueCapacity = -1;
    private CancellationSignal cancel;
    private MergeErrorSink errorSink;
    private boolean deleteSources;

    private Builder() {}

    public Builder sources(List<String> sources) {
      this.sources = Objects.requireNonNull(sources, "sources");
      return this;
    }

    public Builder destination(String destination) {
      this.destination = destination;
      return this;
    }

    public Builder timeExtractor(TimeExtractor timeExtractor) {
      this.timeExtractor = timeExtractor;
      return this;
    }

    public Builder filter(RecordFilter filter) {
      this.filter = filter;
      return this;
    }

    public Builder mode(MergeMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder workers(int workers) {
      this.workers = workers;
      return this;
    }

    /**
     * Sets the hand-off capacity; when never set it defaults to
     * {@link UnorderedWorkerPool#DEFAULT_QUEUE_CAPACITY_PER_WORKER} per worker.
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder cancel(CancellationSignal cancel) {
      this.cancel = cancel;
      return this;
    }

    public Builder errorSink(MergeErrorSink errorSink) {
      this.errorSink = errorSink;
      return this;
    }

    public Builder deleteSources(boolean deleteSources) {
      this.deleteSources = deleteSources;
      return this;
    }

    public MergeJob build() {
      int capacity = queueCapacity < 0
          ? Math.max(1, workers) * UnorderedWorkerPool.DEFAULT_QUEUE_CAPACITY_PER_WORKER
          : queueCapacity;
      return new MergeJob(
          sources, destination, timeExtractor, filter, mode, workers, capacity, cancel, errorSink, deleteSources);
    }
  }
}
