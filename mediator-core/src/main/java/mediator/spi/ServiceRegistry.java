package mediator.spi;

/**
 * Write side of the service container, used at composition time to record registrations.
 *
 * @see ServiceProvider
 * @see mediator.registry.HandlerRegistrar
 */
public interface ServiceRegistry {

  /**
   * Registers a type that is instantiated anew on every resolution. Replaces any registration
   * for the same key.
   *
   * @param key the service key
   * @param implementationType the concrete class to instantiate
   */
  void addTransient(ServiceKey key, Class<?> implementationType);

  /**
   * Registers a shared instance. Replaces any registration for the same key.
   *
   * @param key the service key
   * @param instance the instance returned on every resolution
   */
  void addSingleton(ServiceKey key, Object instance);

  /**
   * Returns the class registered for a key.
   *
   * @param key the service key
   * @return the implementation class (the instance's class for singletons), or {@code null}
   */
  Class<?> implementationTypeFor(ServiceKey key);
}
