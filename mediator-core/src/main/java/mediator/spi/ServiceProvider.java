package mediator.spi;

/**
 * Read side of the service container consulted by the mediator on every dispatch.
 *
 * <p>Implementations own instance creation and lifetimes and must be safe for concurrent
 * {@link #resolve(ServiceKey)} calls.
 *
 * @see ServiceRegistry
 * @see mediator.container.DefaultServiceContainer
 */
public interface ServiceProvider {

  /**
   * Resolves one instance for a key.
   *
   * @param key the service key
   * @return the instance, or {@code null} if nothing is registered for the key
   */
  Object resolve(ServiceKey key);

  /**
   * Resolves one instance of a non-generic service.
   *
   * @param serviceType the service type
   * @param <T> the service type
   * @return the instance, or {@code null} if nothing is registered
   */
  default <T> T resolve(Class<T> serviceType) {
    return serviceType.cast(resolve(ServiceKey.of(serviceType)));
  }
}
