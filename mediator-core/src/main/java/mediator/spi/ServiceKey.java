package mediator.spi;

import mediator.RequestHandler;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Identity of a service in a container: a raw service type plus, for generic services, its
 * type arguments.
 *
 * <p>The handler capability for a {@code (requestType, responseType)} pair is keyed as
 * {@code RequestHandler<requestType, responseType>}; see {@link #forHandler(Class, Type)}.
 *
 * @param serviceType the raw service type
 * @param typeArguments the type arguments, empty for non-generic keys
 */
public record ServiceKey(Class<?> serviceType, List<Type> typeArguments) {

  public ServiceKey {
    Objects.requireNonNull(serviceType, "serviceType");
    typeArguments = List.copyOf(Objects.requireNonNull(typeArguments, "typeArguments"));
    int declared = serviceType.getTypeParameters().length;
    if (!typeArguments.isEmpty() && typeArguments.size() != declared) {
      throw new IllegalArgumentException(serviceType.getName() + " declares " + declared
          + " type parameters but " + typeArguments.size() + " arguments were given");
    }
  }

  /**
   * Key for a service identified by its raw type.
   *
   * @param serviceType the service type
   * @return the key
   */
  public static ServiceKey of(Class<?> serviceType) {
    return new ServiceKey(serviceType, List.of());
  }

  /**
   * Key for a class or parameterized type, e.g. a constructor parameter's generic type.
   *
   * @param type a {@link Class} or {@link ParameterizedType}
   * @return the key
   * @throws IllegalArgumentException for other kinds of types
   */
  public static ServiceKey of(Type type) {
    if (type instanceof Class<?> cls) {
      return of(cls);
    }
    if (type instanceof ParameterizedType parameterized
        && parameterized.getRawType() instanceof Class<?> raw) {
      return new ServiceKey(raw, List.of(parameterized.getActualTypeArguments()));
    }
    throw new IllegalArgumentException("Cannot key a service by " + type.getTypeName());
  }

  /**
   * Key of the handler capability for a request/response pair.
   *
   * @param requestType the concrete request class
   * @param responseType the response type
   * @return the key {@code RequestHandler<requestType, responseType>}
   */
  public static ServiceKey forHandler(Class<?> requestType, Type responseType) {
    Objects.requireNonNull(requestType, "requestType");
    Objects.requireNonNull(responseType, "responseType");
    return new ServiceKey(RequestHandler.class, List.of(requestType, responseType));
  }

  public boolean isHandlerKey() {
    return serviceType == RequestHandler.class && typeArguments.size() == 2;
  }

  /**
   * Request type of a handler key.
   *
   * @return the request class
   * @throws IllegalStateException if this is not a handler key
   */
  public Class<?> requestType() {
    requireHandlerKey();
    return (Class<?>) typeArguments.get(0);
  }

  /**
   * Response type of a handler key.
   *
   * @return the response type
   * @throws IllegalStateException if this is not a handler key
   */
  public Type responseType() {
    requireHandlerKey();
    return typeArguments.get(1);
  }

  private void requireHandlerKey() {
    if (!isHandlerKey()) {
      throw new IllegalStateException("Not a handler key: " + this);
    }
  }

  @Override
  public String toString() {
    if (typeArguments.isEmpty()) {
      return serviceType.getName();
    }
    return typeArguments.stream()
        .map(Type::getTypeName)
        .collect(Collectors.joining(", ", serviceType.getName() + "<", ">"));
  }
}
