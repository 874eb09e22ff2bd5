package mediator;

import java.lang.reflect.Type;

/**
 * Thrown when no handler is registered for a request's {@code (requestType, responseType)} pair.
 *
 * <p>Never retried: the registration set is fixed once the container is composed.
 */
public class HandlerNotFoundException extends RuntimeException {

  private final Class<?> requestType;
  private final Type responseType;

  public HandlerNotFoundException(Class<?> requestType, Type responseType) {
    super("No handler registered for request type " + requestType.getName()
        + " (response type " + responseType.getTypeName() + ")");
    this.requestType = requestType;
    this.responseType = responseType;
  }

  public Class<?> requestType() {
    return requestType;
  }

  public Type responseType() {
    return responseType;
  }
}
