package mediator.dispatch;

import mediator.CancellationToken;
import mediator.HandlerNotFoundException;
import mediator.Mediator;
import mediator.Request;
import mediator.spi.MetricsExporter;
import mediator.spi.ServiceKey;
import mediator.spi.ServiceProvider;
import mediator.util.GenericTypes;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Type;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Mediator}: resolves the handler for a request from a {@link ServiceProvider}
 * and invokes it.
 *
 * <p>Each {@code send} looks up {@code RequestHandler<requestClass, responseType>}, takes the
 * invoker for that key from the {@link HandlerInvokerCache}, and calls the handler exactly once.
 * The returned future is a fresh {@link CompletableFuture} that carries the handler's own
 * outcome: envelopes such as {@link CompletionException} are stripped so callers see the
 * handler's real exception, and a {@link CancellationException} leaves the future cancelled.
 *
 * <p>Instances are cheap and hold no locks; handlers may call {@code send} again on any mediator
 * while they run. Registered containers usually hand out a new instance per resolution.
 *
 * @see mediator.registry.HandlerRegistrar#registerMediator()
 */
public final class DefaultMediator implements Mediator {
  private static final Logger logger = Logger.getLogger(DefaultMediator.class.getName());

  private final ServiceProvider serviceProvider;
  private final HandlerInvokerCache invokerCache;
  private final MetricsExporter metrics;

  public DefaultMediator(ServiceProvider serviceProvider) {
    this(serviceProvider, HandlerInvokerCache.shared(), MetricsExporter.NOOP);
  }

  public DefaultMediator(ServiceProvider serviceProvider, MetricsExporter metrics) {
    this(serviceProvider, HandlerInvokerCache.shared(), metrics);
  }

  public DefaultMediator(ServiceProvider serviceProvider, HandlerInvokerCache invokerCache,
      MetricsExporter metrics) {
    this.serviceProvider = Objects.requireNonNull(serviceProvider, "serviceProvider");
    this.invokerCache = Objects.requireNonNull(invokerCache, "invokerCache");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public <R> CompletableFuture<R> send(Request<R> request, CancellationToken cancellationToken) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(cancellationToken, "cancellationToken");
    Class<?> requestType = request.getClass();
    Type responseType = invokerCache.declaredResponseType(requestType);
    if (responseType == null) {
      throw new IllegalArgumentException("Request type " + requestType.getName()
          + " does not bind the response type of " + Request.class.getSimpleName()
          + "; pass it explicitly");
    }
    return dispatch(ServiceKey.forHandler(requestType, responseType), request, cancellationToken);
  }

  @Override
  public <R> CompletableFuture<R> send(Request<R> request, Class<R> responseType,
      CancellationToken cancellationToken) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(responseType, "responseType");
    Objects.requireNonNull(cancellationToken, "cancellationToken");
    Class<?> requestType = request.getClass();
    Type declared = invokerCache.declaredResponseType(requestType);
    Type keyType = responseType;
    if (declared != null) {
      if (GenericTypes.rawClass(declared) != responseType) {
        throw new IllegalArgumentException("Request type " + requestType.getName()
            + " declares response type " + declared.getTypeName() + " but "
            + responseType.getName() + " was expected");
      }
      keyType = declared;
    }
    return dispatch(ServiceKey.forHandler(requestType, keyType), request, cancellationToken);
  }

  @SuppressWarnings("unchecked")
  private <R> CompletableFuture<R> dispatch(ServiceKey handlerKey, Request<R> request,
      CancellationToken cancellationToken) {
    if (cancellationToken.isCancellationRequested()) {
      metrics.incrementDispatchCancelled();
      CompletableFuture<R> cancelled = new CompletableFuture<>();
      cancelled.cancel(false);
      return cancelled;
    }
    Object handler;
    try {
      handler = serviceProvider.resolve(handlerKey);
    } catch (RuntimeException e) {
      metrics.incrementDispatchFailure();
      return CompletableFuture.failedFuture(e);
    }
    if (handler == null) {
      metrics.incrementDispatchUnroutable();
      return CompletableFuture.failedFuture(
          new HandlerNotFoundException(handlerKey.requestType(), handlerKey.responseType()));
    }
    HandlerInvoker invoker = invokerCache.invokerFor(handlerKey);

    CompletableFuture<R> result = new CompletableFuture<>();
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("Dispatching " + handlerKey + " to " + handler.getClass().getName());
    }

    long startNanos = System.nanoTime();
    result.whenComplete((value, error) -> recordOutcome(result, startNanos));
    CancellationToken.Registration registration = cancellationToken.register(() -> result.cancel(false));
    if (result.isDone()) {
      // token fired after the check at entry
      return result;
    }

    CompletionStage<Object> stage;
    try {
      stage = invoker.invoke(handler, request, cancellationToken);
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    stage.whenComplete((value, error) -> {
      registration.close();
      if (error != null) {
        result.completeExceptionally(unwrap(error));
      } else {
        result.complete((R) value);
      }
    });
    return result;
  }

  private void recordOutcome(CompletableFuture<?> result, long startNanos) {
    metrics.recordHandlerDurationMs(
        TimeUnit.NANOSECONDS.toMillis(Math.max(0, System.nanoTime() - startNanos)));
    if (result.isCancelled()) {
      metrics.incrementDispatchCancelled();
    } else if (result.isCompletedExceptionally()) {
      metrics.incrementDispatchFailure();
    } else {
      metrics.incrementDispatchSuccess();
    }
  }

  /**
   * Strips the envelopes that asynchronous composition or reflective invocation put around a
   * handler's exception.
   */
  static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException
        || current instanceof ExecutionException
        || current instanceof InvocationTargetException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
