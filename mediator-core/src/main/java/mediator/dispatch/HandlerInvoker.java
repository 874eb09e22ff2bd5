package mediator.dispatch;

import mediator.CancellationToken;
import mediator.Request;
import mediator.RequestHandler;
import mediator.spi.ServiceKey;

import java.util.concurrent.CompletionStage;

/**
 * Type-erased entry point for one handler capability.
 *
 * <p>Built once per {@link ServiceKey} and cached by {@link HandlerInvokerCache}. Invocation is a
 * checked cast plus a direct interface call; no reflection runs per dispatch.
 */
public final class HandlerInvoker {

  private final ServiceKey handlerKey;
  private final Class<?> requestType;

  private HandlerInvoker(ServiceKey handlerKey) {
    this.handlerKey = handlerKey;
    this.requestType = handlerKey.requestType();
  }

  /**
   * Creates the invoker for a handler key.
   *
   * @param handlerKey a key built by {@link ServiceKey#forHandler(Class, java.lang.reflect.Type)}
   * @return the invoker
   * @throws IllegalArgumentException if the key is not a handler key for a request class
   */
  public static HandlerInvoker forKey(ServiceKey handlerKey) {
    if (!handlerKey.isHandlerKey()) {
      throw new IllegalArgumentException("Not a handler key: " + handlerKey);
    }
    if (!Request.class.isAssignableFrom(handlerKey.requestType())) {
      throw new IllegalArgumentException(handlerKey.requestType().getName()
          + " does not implement " + Request.class.getName());
    }
    return new HandlerInvoker(handlerKey);
  }

  public ServiceKey handlerKey() {
    return handlerKey;
  }

  /**
   * Calls {@link RequestHandler#handle} on a resolved handler.
   *
   * @param handler the instance resolved for {@link #handlerKey()}
   * @param request the request
   * @param cancellationToken the caller's token
   * @return the stage returned by the handler, never {@code null}
   * @throws IllegalStateException if the instance is not a handler or returns {@code null}
   * @throws Exception whatever the handler throws
   */
  @SuppressWarnings("unchecked")
  public CompletionStage<Object> invoke(Object handler, Request<?> request,
      CancellationToken cancellationToken) throws Exception {
    if (!(handler instanceof RequestHandler<?, ?>)) {
      throw new IllegalStateException("Service resolved for " + handlerKey + " is a "
          + handler.getClass().getName() + ", not a " + RequestHandler.class.getSimpleName());
    }
    RequestHandler<Request<Object>, Object> typed = (RequestHandler<Request<Object>, Object>) handler;
    CompletionStage<Object> stage =
        typed.handle((Request<Object>) requestType.cast(request), cancellationToken);
    if (stage == null) {
      throw new IllegalStateException("Handler " + handler.getClass().getName()
          + " returned null for request type " + requestType.getName());
    }
    return stage;
  }

  @Override
  public String toString() {
    return "HandlerInvoker[" + handlerKey + "]";
  }
}
