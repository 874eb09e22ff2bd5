package mediator.dispatch;

import mediator.Request;
import mediator.spi.ServiceKey;
import mediator.util.GenericTypes;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Insert-if-absent cache of dispatch metadata: the {@link HandlerInvoker} per handler key and the
 * declared response type per request class.
 *
 * <p>Entries are pure functions of their key and are never evicted, since registrations are
 * fixed once the container is composed. Concurrent first lookups of the same key may each
 * compute a value; the first one stored wins. {@link DefaultMediator} instances are transient, so
 * they share {@link #shared()} unless given their own cache.
 */
public final class HandlerInvokerCache {
  private static final Logger logger = Logger.getLogger(HandlerInvokerCache.class.getName());

  private static final HandlerInvokerCache SHARED = new HandlerInvokerCache();

  private final Map<ServiceKey, HandlerInvoker> invokers = new ConcurrentHashMap<>();
  private final Map<Class<?>, Type> responseTypes = new ConcurrentHashMap<>();

  /**
   * Returns the process-wide cache.
   *
   * @return the shared instance
   */
  public static HandlerInvokerCache shared() {
    return SHARED;
  }

  /**
   * Returns the invoker for a handler key, building and caching it on first use.
   *
   * @param handlerKey the handler key
   * @return the cached invoker
   */
  public HandlerInvoker invokerFor(ServiceKey handlerKey) {
    HandlerInvoker invoker = invokers.get(handlerKey);
    if (invoker != null) {
      return invoker;
    }
    HandlerInvoker created = HandlerInvoker.forKey(handlerKey);
    invoker = invokers.putIfAbsent(handlerKey, created);
    if (invoker == null) {
      logger.log(Level.FINE, "Cached invoker for {0}", handlerKey);
      return created;
    }
    return invoker;
  }

  /**
   * Returns the response type a request class binds for {@link Request}.
   *
   * @param requestType the concrete request class
   * @return the declared response type, or {@code null} if the class leaves it generic
   */
  public Type declaredResponseType(Class<?> requestType) {
    Type cached = responseTypes.get(requestType);
    if (cached != null) {
      return cached == Unresolved.class ? null : cached;
    }
    Type[] arguments = GenericTypes.resolveTypeArguments(requestType, Request.class);
    Type resolved = arguments != null && GenericTypes.isFullyResolved(arguments[0])
        ? arguments[0] : Unresolved.class;
    Type existing = responseTypes.putIfAbsent(requestType, resolved);
    Type result = existing != null ? existing : resolved;
    return result == Unresolved.class ? null : result;
  }

  /**
   * Number of cached invokers.
   *
   * @return the invoker count
   */
  public int size() {
    return invokers.size();
  }

  /** Marker for request classes whose response type stays generic. */
  private static final class Unresolved {
  }
}
