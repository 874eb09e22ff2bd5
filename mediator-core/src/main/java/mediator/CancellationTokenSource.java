package mediator;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owner of a {@link CancellationToken}.
 *
 * <p>{@link #cancel()} fires the token at most once; each registered callback runs exactly once,
 * either during {@code cancel()} or, for callbacks registered afterwards, immediately on
 * registration. This class is thread-safe.
 *
 * <pre>{@code
 * CancellationTokenSource source = new CancellationTokenSource();
 * CompletableFuture<Report> report = mediator.send(new BuildReport(), source.token());
 * source.cancelAfter(Duration.ofSeconds(30));
 * }</pre>
 */
public final class CancellationTokenSource {
  private static final Logger logger = Logger.getLogger(CancellationTokenSource.class.getName());

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CopyOnWriteArrayList<Callback> callbacks = new CopyOnWriteArrayList<>();
  private final CancellationToken token = new SourceToken();

  /**
   * Returns the token controlled by this source.
   *
   * @return the token
   */
  public CancellationToken token() {
    return token;
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }

  /**
   * Requests cancellation and runs the registered callbacks on the calling thread.
   *
   * <p>All callbacks run even if some throw; the first exception is rethrown afterwards with the
   * others suppressed. Calling this again has no effect.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    for (Callback callback : callbacks) {
      if (!callbacks.remove(callback)) {
        continue;
      }
      try {
        callback.action.run();
      } catch (RuntimeException e) {
        if (first == null) {
          first = e;
        } else {
          first.addSuppressed(e);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Schedules {@link #cancel()} after the given delay on a shared daemon thread. Exceptions thrown
   * by callbacks on that thread are logged.
   *
   * @param delay time to wait before cancelling; zero cancels immediately
   * @throws IllegalArgumentException if {@code delay} is negative
   */
  public void cancelAfter(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must be >= 0");
    }
    if (delay.isZero()) {
      cancel();
      return;
    }
    if (cancelled.get()) {
      return;
    }
    Scheduler.INSTANCE.schedule(() -> {
      try {
        cancel();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Cancellation callback failed", e);
      }
    }, delay.toNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public String toString() {
    return "CancellationTokenSource[cancelled=" + cancelled.get() + "]";
  }

  private CancellationToken.Registration register(Runnable action) {
    Objects.requireNonNull(action, "callback");
    if (cancelled.get()) {
      action.run();
      return CancellationToken.Registration.EMPTY;
    }
    Callback callback = new Callback(action);
    callbacks.add(callback);
    // cancel() may have taken its snapshot before the add
    if (cancelled.get() && callbacks.remove(callback)) {
      action.run();
      return CancellationToken.Registration.EMPTY;
    }
    return () -> callbacks.remove(callback);
  }

  private static final class Callback {
    private final Runnable action;

    private Callback(Runnable action) {
      this.action = action;
    }
  }

  private final class SourceToken implements CancellationToken {

    @Override
    public boolean isCancellationRequested() {
      return cancelled.get();
    }

    @Override
    public Registration register(Runnable callback) {
      return CancellationTokenSource.this.register(callback);
    }

    @Override
    public String toString() {
      return "CancellationToken[cancelled=" + cancelled.get() + "]";
    }
  }

  private static final class Scheduler {
    private static final ScheduledExecutorService INSTANCE =
        Executors.newSingleThreadScheduledExecutor(runnable -> {
          Thread thread = new Thread(runnable, "mediator-cancel-timer");
          thread.setDaemon(true);
          return thread;
        });
  }
}
