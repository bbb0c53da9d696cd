package ca.gc.cra.logmerge.application.merge;

import java.util.Arrays;
import java.util.BitSet;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Binary min-heap of active {@link RecordCursor}s keyed by their current record key.
 *
 * <p>Equal keys are broken by cursor ordinal (source position in the job), so the output order is
 * deterministic for a fixed source order. Exhausted cursors are rejected, as is a second cursor
 * with the ordinal of one already present.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PriorityFrontier {
  private static final int DEFAULT_CAPACITY = 16;

  private RecordCursor[] heap;
  private int size;
  private final BitSet present = new BitSet();

  public PriorityFrontier() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a frontier sized for {@code expectedSources} cursors.
   *
   * @param expectedSources initial capacity hint; grows on demand
   */
  public PriorityFrontier(int expectedSources) {
    heap = new RecordCursor[Math.max(1, expectedSources)];
  }

  /**
   * Adds a primed, non-exhausted cursor.
   *
   * @param cursor cursor to insert
   * @throws IllegalArgumentException if the cursor is exhausted or its source is already present
   */
  public void insert(RecordCursor cursor) {
    Objects.requireNonNull(cursor, "cursor");
    if (cursor.exhausted()) {
      throw new IllegalArgumentException("exhausted cursor for " + cursor.label() + " cannot enter the frontier");
    }
    if (present.get(cursor.ordinal())) {
      throw new IllegalArgumentException("source " + cursor.label() + " already has a cursor in the frontier");
    }
    if (size == heap.length) {
      heap = Arrays.copyOf(heap, heap.length << 1);
    }
    heap[size] = cursor;
    siftUp(size);
    size++;
    present.set(cursor.ordinal());
  }

  /**
   * Removes and returns the cursor holding the smallest key.
   *
   * @return minimum cursor
   * @throws NoSuchElementException if the frontier is empty
   */
  public RecordCursor extractMin() {
    if (size == 0) {
      throw new NoSuchElementException("frontier is empty");
    }
    RecordCursor min = heap[0];
    size--;
    heap[0] = heap[size];
    heap[size] = null;
    if (size > 0) {
      siftDown(0);
    }
    present.clear(min.ordinal());
    return min;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int size() {
    return size;
  }

  private void siftUp(int index) {
    RecordCursor moving = heap[index];
    while (index > 0) {
      int parent = (index - 1) >>> 1;
      if (!moving.precedes(heap[parent])) {
        break;
      }
      heap[index] = heap[parent];
      index = parent;
    }
    heap[index] = moving;
  }

  private void siftDown(int index) {
    RecordCursor moving = heap[index];
    int half = size >>> 1;
    while (index < half) {
      int child = (index << 1) + 1;
      int right = child + 1;
      if (right < size && heap[right].precedes(heap[child])) {
        child = right;
      }
      if (!heap[child].precedes(moving)) {
        break;
      }
      heap[index] = heap[child];
      index = child;
    }
    heap[index] = moving;
  }
}
