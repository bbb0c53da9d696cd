package ca.gc.cra.logmerge.application.merge;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared, one-way cancellation flag observed cooperatively by concurrent workers and the writer loop.
 *
 * <p>Once cancelled a signal stays cancelled. Safe for use from any thread, including JVM shutdown hooks.</p>
 *
 * @since 0.1.0
 */
public final class CancellationSignal {
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * Requests cancellation.
   *
   * @return {@code true} if this call transitioned the signal, {@code false} if it was already cancelled
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  /**
   * Indicates whether cancellation has been requested.
   *
   * @return {@code true} once {@link #cancel()} has been called
   */
  public boolean isCancelled() {
    return cancelled.get();
  }
}
