package ca.gc.cra.logmerge.application.merge;

import ca.gc.cra.logmerge.application.merge.HandlerAbortException.Stage;
import ca.gc.cra.logmerge.application.port.MergeErrorSink;
import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.application.port.RecordSink;
import ca.gc.cra.logmerge.application.port.RecordSource;
import ca.gc.cra.logmerge.domain.merge.FilterResult;
import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.domain.merge.MergeReport;
import ca.gc.cra.logmerge.domain.merge.SourceFailure;
import ca.gc.cra.logmerge.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drains every source in parallel into one destination, trading cross-source ordering for throughput.
 *
 * <p>A fixed pool of workers (threads named <code>merge-worker-</code>) pulls source jobs from a shared
 * job queue and pushes accepted records onto a bounded hand-off queue; the calling thread runs the
 * single writer loop that writes and flushes each record. The hand-off capacity bounds memory and
 * blocks fast sources while the writer catches up. The last worker to finish closes the hand-off.</p>
 *
 * <p>Per-source failures (unreadable source, filter {@code STOP}) are reported on the
 * {@link MergeErrorSink} and end only that source. Cancellation is cooperative: workers and the
 * writer check the {@link CancellationSignal} on every iteration, and the writer returns without
 * draining what is still queued. Records of one source keep their relative order.</p>
 *
 * <p>Instances hold only tuning parameters and may be reused; each {@link #run} call owns its own
 * queues and workers.</p>
 *
 * @since 0.1.0
 */
public final class UnorderedWorkerPool {
  private static final Logger log = LoggerFactory.getLogger(UnorderedWorkerPool.class);

  /** Default hand-off capacity per worker. */
  public static final int DEFAULT_QUEUE_CAPACITY_PER_WORKER = 128;

  private static final long WRITER_IDLE_POLL_MILLIS = 25L;
  private static final long ENQUEUE_WAIT_MILLIS = 25L;
  private static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int DEPTH_SAMPLE_INTERVAL = 256;

  private final int queueCapacity;
  private final MetricsPort metrics;

  /**
   * Creates a pool whose hand-off queue holds at most {@code queueCapacity} records.
   *
   * @param queueCapacity hand-off capacity; must be positive
   * @param metrics metrics sink
   */
  public UnorderedWorkerPool(int queueCapacity, MetricsPort metrics) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.queueCapacity = queueCapacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Drains {@code sources} into {@code destination} without ordering guarantees across sources.
   *
   * @param sources open sources; owned by the caller
   * @param destination open sink; owned by the caller
   * @param filter optional filter strategy; {@code null} accepts every record as-is
   * @param workerCount number of worker threads; must be positive
   * @param cancel cancellation signal; {@code null} means the run cannot be cancelled
   * @param errorSink required channel receiving per-source failures
   * @return report listing written records, reported failures, and whether the run was cancelled
   * @throws ConfigurationException if {@code errorSink} is missing or {@code workerCount} is not positive
   * @throws DestinationException if the destination cannot be written; workers are stopped
   * @throws InterruptedException if the calling thread is interrupted while waiting for records
   */
  public MergeReport run(
      List<? extends RecordSource> sources,
      RecordSink destination,
      RecordFilter filter,
      int workerCount,
      CancellationSignal cancel,
      MergeErrorSink errorSink) throws MergeException, InterruptedException {
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(destination, "destination");
    if (errorSink == null) {
      throw new ConfigurationException("error sink is required for concurrent merges");
    }
    if (workerCount <= 0) {
      throw new ConfigurationException("workerCount must be positive (was " + workerCount + ")");
    }
    CancellationSignal signal = cancel == null ? new CancellationSignal() : cancel;
    return new Drain(sources, destination, filter, workerCount, signal, errorSink).execute();
  }

  /** State of one {@link #run} invocation. */
  private final class Drain {
    private final RecordSink destination;
    private final RecordFilter filter;
    private final int workerCount;
    private final CancellationSignal cancel;
    private final MergeErrorSink errorSink;

    private final Queue<RecordSource> jobs;
    private final BlockingQueue<byte[]> handoff = new ArrayBlockingQueue<>(queueCapacity);
    private final AtomicInteger finishedWorkers = new AtomicInteger();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final Queue<SourceFailure> failures = new ConcurrentLinkedQueue<>();
    private final LongAdder skipped = new LongAdder();
    private final AtomicInteger highWater = new AtomicInteger();
    private volatile boolean closed;

    private Drain(
        List<? extends RecordSource> sources,
        RecordSink destination,
        RecordFilter filter,
        int workerCount,
        CancellationSignal cancel,
        MergeErrorSink errorSink) {
      this.jobs = new ConcurrentLinkedQueue<>(sources);
      this.destination = destination;
      this.filter = filter;
      this.workerCount = workerCount;
      this.cancel = cancel;
      this.errorSink = errorSink;
    }

    MergeReport execute() throws MergeException, InterruptedException {
      String prefix = "merge-worker-" + Integer.toHexString(System.identityHashCode(this));
      ExecutorService executor = ExecutorFactories.newWorkerPool(workerCount, prefix, this::handleWorkerCrash);
      log.info("Started {} merge workers for {} sources with hand-off capacity {}",
          workerCount, jobs.size(), queueCapacity);
      long written = 0;
      boolean cancelled = false;
      try {
        for (int i = 0; i < workerCount; i++) {
          executor.execute(new Worker());
        }
        while (true) {
          if (cancel.isCancelled()) {
            cancelled = true;
            log.info("Merge cancelled; {} queued records left unwritten", handoff.size());
            break;
          }
          byte[] record = handoff.poll(WRITER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (record == null) {
            if (closed && handoff.isEmpty()) {
              break;
            }
            continue;
          }
          try {
            destination.write(record);
            destination.flush();
          } catch (IOException ex) {
            throw new DestinationException("Failed to write merged record", ex);
          }
          written++;
          metrics.increment("merge.concurrent.records.written");
          if (written % DEPTH_SAMPLE_INTERVAL == 0) {
            metrics.observe("merge.concurrent.queue.depth", handoff.size());
          }
        }
      } finally {
        stopRequested.set(true);
        shutdown(executor);
      }
      metrics.observe("merge.concurrent.queue.highWater", highWater.get());
      return new MergeReport(MergeMode.CONCURRENT, written, skipped.sum(), List.copyOf(failures), cancelled);
    }

    private boolean halted() {
      return stopRequested.get() || cancel.isCancelled();
    }

    private final class Worker implements Runnable {
      @Override
      public void run() {
        MDC.put("pipeline", "merge-concurrent");
        try {
          RecordSource source;
          while (!halted() && (source = jobs.poll()) != null) {
            MDC.put("source", source.label());
            try {
              drainSource(source);
            } catch (RuntimeException ex) {
              report(source.label(), new SourceAccessException(source.label(), ex));
            } finally {
              MDC.remove("source");
            }
          }
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          log.debug("Merge worker interrupted");
        } finally {
          MDC.remove("pipeline");
          workerFinished();
        }
      }
    }

    private void drainSource(RecordSource source) throws InterruptedException {
      long accepted = 0;
      while (!halted()) {
        Optional<byte[]> raw;
        try {
          raw = source.next();
        } catch (IOException | RuntimeException ex) {
          report(source.label(), new SourceAccessException(source.label(), ex));
          return;
        }
        if (raw.isEmpty()) {
          log.debug("Source {} drained after {} accepted records", source.label(), accepted);
          return;
        }
        byte[] out = raw.get();
        if (filter != null) {
          FilterResult result;
          try {
            result = Objects.requireNonNull(filter.filter(source.label(), out), "record filter returned null");
          } catch (RuntimeException ex) {
            report(source.label(), new HandlerAbortException(Stage.RECORD_FILTER, source.label(), ex));
            return;
          }
          switch (result.action()) {
            case SKIP -> {
              skipped.increment();
              metrics.increment("merge.concurrent.records.skipped");
              continue;
            }
            case STOP -> {
              report(source.label(), new HandlerAbortException(Stage.RECORD_FILTER, source.label(), result.cause()));
              return;
            }
            case ACCEPT -> out = Arrays.copyOf(result.record(), result.record().length);
          }
        }
        if (!enqueue(out)) {
          return;
        }
        accepted++;
      }
    }

    private boolean enqueue(byte[] record) throws InterruptedException {
      while (true) {
        if (handoff.offer(record, ENQUEUE_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
          updateHighWater(handoff.size());
          return true;
        }
        metrics.increment("merge.concurrent.enqueue.retry");
        if (halted()) {
          return false;
        }
      }
    }

    private void workerFinished() {
      if (finishedWorkers.incrementAndGet() == workerCount) {
        closed = true;
        log.debug("All {} merge workers finished; hand-off closed", workerCount);
      }
    }

    private void report(String label, MergeException failure) {
      metrics.increment("merge.concurrent.source.failed");
      SourceFailure reported = new SourceFailure(label, failure);
      failures.add(reported);
      try {
        errorSink.report(reported);
      } catch (RuntimeException ex) {
        log.error("Error sink rejected failure report for source {}", label, ex);
      }
    }

    private void updateHighWater(int depth) {
      int previous;
      do {
        previous = highWater.get();
        if (depth <= previous) {
          return;
        }
      } while (!highWater.compareAndSet(previous, depth));
    }

    private void handleWorkerCrash(Thread thread, Throwable throwable) {
      log.error("Merge worker {} threw an uncaught exception", thread.getName(), throwable);
      stopRequested.set(true);
    }

    private void shutdown(ExecutorService executor) {
      executor.shutdown();
      boolean terminated = false;
      try {
        terminated = executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
          log.warn("Merge workers active after {} ms; forcing shutdown", WORKER_SHUTDOWN_TIMEOUT.toMillis());
          executor.shutdownNow();
          terminated = executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException ie) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
      if (!terminated) {
        log.error("Merge workers failed to terminate cleanly");
      }
    }
  }
}
