package ca.gc.cra.logmerge.application.merge;

import ca.gc.cra.logmerge.application.merge.HandlerAbortException.Stage;
import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.application.port.RecordSource;
import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.domain.merge.Extraction;
import ca.gc.cra.logmerge.domain.merge.FilterResult;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks the next accepted, not-yet-emitted record of one source.
 *
 * <p>While {@link #exhausted()} is {@code false}, {@link #record()} and {@link #key()} describe a
 * record that passed both the time extractor and the filter. {@link #advance()} replaces both from
 * the next accepted raw record or marks the cursor exhausted. A cursor that failed (threw from
 * {@code advance}) keeps its previous state and must be discarded by the caller.</p>
 *
 * <p>Not thread-safe; owned by a single merger.</p>
 *
 * @since 0.1.0
 */
public final class RecordCursor {
  private final RecordSource source;
  private final int ordinal;
  private final TimeExtractor timeExtractor;
  private final RecordFilter filter;

  private byte[] record;
  private long key;
  private boolean exhausted;
  private long skipped;

  /**
   * Creates an unprimed cursor; call {@link #advance()} once before reading its state.
   *
   * @param source source to read; owned by the caller
   * @param ordinal position of the source in the job, used as the tie-break for equal keys
   * @param timeExtractor required time-extraction strategy
   * @param filter optional filter strategy; {@code null} accepts every extracted record as-is
   */
  public RecordCursor(RecordSource source, int ordinal, TimeExtractor timeExtractor, RecordFilter filter) {
    this.source = Objects.requireNonNull(source, "source");
    if (ordinal < 0) {
      throw new IllegalArgumentException("ordinal must be non-negative");
    }
    this.ordinal = ordinal;
    this.timeExtractor = Objects.requireNonNull(timeExtractor, "timeExtractor");
    this.filter = filter;
  }

  /**
   * Pulls raw records until one is accepted or the source ends.
   *
   * @throws HandlerAbortException if the time extractor or the filter returned {@code STOP} (or threw)
   * @throws SourceAccessException if the source cannot be read
   */
  public void advance() throws HandlerAbortException, SourceAccessException {
    while (true) {
      Optional<byte[]> raw;
      try {
        raw = source.next();
      } catch (IOException | RuntimeException ex) {
        throw new SourceAccessException(source.label(), ex);
      }
      if (raw.isEmpty()) {
        exhausted = true;
        record = null;
        return;
      }

      byte[] line = raw.get();
      Extraction extraction = extract(line);
      switch (extraction.action()) {
        case SKIP -> {
          skipped++;
          continue;
        }
        case STOP -> throw new HandlerAbortException(Stage.TIME_EXTRACTOR, source.label(), extraction.cause());
        case ACCEPT -> {
          // fall through to the filter below
        }
      }

      byte[] accepted = line;
      if (filter != null) {
        FilterResult result = applyFilter(line);
        switch (result.action()) {
          case SKIP -> {
            skipped++;
            continue;
          }
          case STOP -> throw new HandlerAbortException(Stage.RECORD_FILTER, source.label(), result.cause());
          case ACCEPT -> accepted = result.record();
        }
      }

      key = extraction.key();
      record = accepted;
      return;
    }
  }

  private Extraction extract(byte[] line) throws HandlerAbortException {
    try {
      return Objects.requireNonNull(timeExtractor.extract(line), "time extractor returned null");
    } catch (RuntimeException ex) {
      throw new HandlerAbortException(Stage.TIME_EXTRACTOR, source.label(), ex);
    }
  }

  private FilterResult applyFilter(byte[] line) throws HandlerAbortException {
    try {
      return Objects.requireNonNull(filter.filter(source.label(), line), "record filter returned null");
    } catch (RuntimeException ex) {
      throw new HandlerAbortException(Stage.RECORD_FILTER, source.label(), ex);
    }
  }

  public String label() {
    return source.label();
  }

  public int ordinal() {
    return ordinal;
  }

  /**
   * Current record bytes.
   *
   * @return accepted record; {@code null} once exhausted
   */
  public byte[] record() {
    return record;
  }

  public long key() {
    return key;
  }

  public boolean exhausted() {
    return exhausted;
  }

  /**
   * Number of raw records this cursor discarded because a strategy returned {@code SKIP}.
   *
   * @return skip count
   */
  public long skipped() {
    return skipped;
  }

  /**
   * Orders cursors by current key, then by ordinal.
   *
   * @param other cursor to compare with
   * @return {@code true} when this cursor must be emitted before {@code other}
   */
  boolean precedes(RecordCursor other) {
    if (key != other.key) {
      return key < other.key;
    }
    return ordinal < other.ordinal;
  }
}
