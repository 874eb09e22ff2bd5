package mediator;

import java.util.concurrent.CancellationException;

/**
 * Read-only view of a cancellation signal.
 *
 * <p>Tokens are created by a {@link CancellationTokenSource}; {@link #NONE} is a token that never
 * fires. Cancellation is cooperative: handlers poll {@link #isCancellationRequested()} or call
 * {@link #throwIfCancellationRequested()}, or {@linkplain #register(Runnable) register} a callback.
 */
public interface CancellationToken {

  /** A token that is never cancelled. */
  CancellationToken NONE = new None();

  /**
   * Returns whether cancellation has been requested.
   *
   * @return {@code true} once the owning source was cancelled
   */
  boolean isCancellationRequested();

  /**
   * Throws if cancellation has been requested.
   *
   * @throws CancellationException if cancellation has been requested
   */
  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new CancellationException("Operation was cancelled");
    }
  }

  /**
   * Registers a callback to run once when cancellation is requested. If the token is already
   * cancelled the callback runs immediately on the calling thread.
   *
   * @param callback the callback
   * @return a registration that removes the callback when closed
   */
  Registration register(Runnable callback);

  /**
   * Handle for a registered callback. Closing it after the callback ran has no effect.
   */
  @FunctionalInterface
  interface Registration extends AutoCloseable {

    /** Registration that holds nothing. */
    Registration EMPTY = () -> {
    };

    @Override
    void close();
  }

  /** Token that never fires. */
  final class None implements CancellationToken {

    private None() {
    }

    @Override
    public boolean isCancellationRequested() {
      return false;
    }

    @Override
    public Registration register(Runnable callback) {
      return Registration.EMPTY;
    }

    @Override
    public String toString() {
      return "CancellationToken.NONE";
    }
  }
}
