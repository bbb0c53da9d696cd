package ca.gc.cra.logmerge.infrastructure.io;

/**
 * Expandable byte buffer with manual read/write indices, used to split a stream into lines.
 * <p>Grows by doubling up to a hard cap so one oversized record cannot exhaust the heap.</p>
 */
final class LineBuffer {
  private static final int DEFAULT_CAPACITY = 8192;

  private final int maxCapacity;
  private byte[] data;
  private int readIndex;
  private int writeIndex;

  /**
   * Creates a buffer that never grows beyond {@code maxCapacity} bytes.
   *
   * @param maxCapacity hard cap on the backing array
   * @throws IllegalArgumentException when {@code maxCapacity} is not positive
   */
  LineBuffer(int maxCapacity) {
    if (maxCapacity <= 0) {
      throw new IllegalArgumentException("maxCapacity must be positive");
    }
    this.maxCapacity = maxCapacity;
    this.data = new byte[Math.min(maxCapacity, DEFAULT_CAPACITY)];
  }

  int readableBytes() {
    return writeIndex - readIndex;
  }

  /** Free space left before the cap is reached. */
  int remainingCapacity() {
    return maxCapacity - readableBytes();
  }

  /**
   * Makes room for at least {@code minWritableBytes}. Callers then read directly into {@link #array()}
   * at {@link #writerIndex()} and call {@link #advanceWriter(int)}.
   */
  void ensureWritable(int minWritableBytes) {
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    compact();
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    int required = readableBytes() + minWritableBytes;
    if (required > maxCapacity) {
      throw new IllegalStateException("buffer would exceed max capacity: " + required);
    }
    int newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity = Math.min(maxCapacity, newCapacity << 1);
    }
    byte[] next = new byte[newCapacity];
    int readable = readableBytes();
    System.arraycopy(data, readIndex, next, 0, readable);
    data = next;
    readIndex = 0;
    writeIndex = readable;
  }

  byte[] array() {
    return data;
  }

  int writerIndex() {
    return writeIndex;
  }

  int writableBytes() {
    return data.length - writeIndex;
  }

  void advanceWriter(int length) {
    if (length < 0 || length > writableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    writeIndex += length;
  }

  /** Relative index of the first {@code value} at or after the reader index, or {@code -1}. */
  int indexOf(byte value, int fromRelative) {
    for (int i = readIndex + fromRelative; i < writeIndex; i++) {
      if (data[i] == value) {
        return i - readIndex;
      }
    }
    return -1;
  }

  /** Copies {@code length} readable bytes out and consumes them. */
  byte[] take(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    byte[] out = new byte[length];
    System.arraycopy(data, readIndex, out, 0, length);
    skip(length);
    return out;
  }

  void skip(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    readIndex += length;
    if (readIndex == writeIndex) {
      readIndex = 0;
      writeIndex = 0;
    }
  }

  private void compact() {
    if (readIndex == 0) {
      return;
    }
    int readable = readableBytes();
    if (readable > 0) {
      System.arraycopy(data, readIndex, data, 0, readable);
    }
    readIndex = 0;
    writeIndex = readable;
  }

  @Override
  public String toString() {
    return "LineBuffer[readable=" + readableBytes() + ", capacity=" + data.length + "/" + maxCapacity + "]";
  }
}
