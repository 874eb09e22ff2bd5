package mediator.container;

import mediator.spi.ServiceKey;
import mediator.spi.ServiceProvider;
import mediator.spi.ServiceRegistry;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * In-memory service container for applications that do not bring their own.
 *
 * <p>Transient registrations are instantiated on every {@link #resolve(ServiceKey)} through
 * constructor injection: the constructor with the most parameters whose types are all
 * registered wins, and each parameter is resolved by {@link ServiceKey#of(Type)} of its generic
 * type. The container registers itself as the {@link ServiceProvider}, so services may depend
 * on it.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultServiceContainer container = new DefaultServiceContainer()
 *     .singleton(UserRepository.class, new InMemoryUserRepository());
 * Mediators.addMediator(container, GetUserHandler.class, DeleteUserHandler.class);
 *
 * Mediator mediator = container.resolve(Mediator.class);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Registrations and resolutions may happen concurrently. Registrations are expected to be
 * complete before the first resolution.
 */
public final class DefaultServiceContainer implements ServiceProvider, ServiceRegistry {
  private static final Logger logger = Logger.getLogger(DefaultServiceContainer.class.getName());

  private final Map<ServiceKey, Registration> registrations = new ConcurrentHashMap<>();
  private final Map<Class<?>, Constructor<?>> constructors = new ConcurrentHashMap<>();
  private final ThreadLocal<Set<ServiceKey>> resolving = ThreadLocal.withInitial(LinkedHashSet::new);

  public DefaultServiceContainer() {
    addSingleton(ServiceKey.of(ServiceProvider.class), this);
  }

  @Override
  public void addTransient(ServiceKey key, Class<?> implementationType) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(implementationType, "implementationType");
    if (implementationType.isInterface() || Modifier.isAbstract(implementationType.getModifiers())) {
      throw new IllegalArgumentException("Cannot instantiate " + implementationType.getName());
    }
    if (!key.serviceType().isAssignableFrom(implementationType)) {
      throw new IllegalArgumentException(implementationType.getName() + " does not implement "
          + key.serviceType().getName());
    }
    registrations.put(key, new Registration(implementationType, null));
    constructors.clear();
  }

  @Override
  public void addSingleton(ServiceKey key, Object instance) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(instance, "instance");
    if (!key.serviceType().isInstance(instance)) {
      throw new IllegalArgumentException(instance.getClass().getName() + " does not implement "
          + key.serviceType().getName());
    }
    registrations.put(key, new Registration(instance.getClass(), instance));
    constructors.clear();
  }

  /**
   * Registers a transient service keyed by its own raw type.
   *
   * @param serviceType the service type
   * @param implementationType the class to instantiate
   * @param <T> the service type
   * @return this container for chaining
   */
  public <T> DefaultServiceContainer transientService(Class<T> serviceType,
      Class<? extends T> implementationType) {
    addTransient(ServiceKey.of(serviceType), implementationType);
    return this;
  }

  /**
   * Registers a shared instance keyed by a raw type.
   *
   * @param serviceType the service type
   * @param instance the instance
   * @param <T> the service type
   * @return this container for chaining
   */
  public <T> DefaultServiceContainer singleton(Class<T> serviceType, T instance) {
    addSingleton(ServiceKey.of(serviceType), instance);
    return this;
  }

  @Override
  public Class<?> implementationTypeFor(ServiceKey key) {
    Registration registration = registrations.get(key);
    return registration == null ? null : registration.type;
  }

  /**
   * Resolves a service.
   *
   * @param key the service key
   * @return the instance, or {@code null} if the key is not registered
   * @throws ServiceResolutionException if the service or one of its dependencies cannot be
   *     created
   */
  @Override
  public Object resolve(ServiceKey key) {
    Objects.requireNonNull(key, "key");
    Registration registration = registrations.get(key);
    if (registration == null) {
      return null;
    }
    if (registration.instance != null) {
      return registration.instance;
    }
    Set<ServiceKey> inProgress = resolving.get();
    if (!inProgress.add(key)) {
      String chain = inProgress.stream().map(ServiceKey::toString).collect(Collectors.joining(" -> "));
      throw new ServiceResolutionException("Circular dependency: " + chain + " -> " + key);
    }
    try {
      return instantiate(registration.type);
    } finally {
      inProgress.remove(key);
      if (inProgress.isEmpty()) {
        resolving.remove();
      }
    }
  }

  private Object instantiate(Class<?> type) {
    Constructor<?> constructor = constructors.computeIfAbsent(type, this::selectConstructor);
    Type[] parameterTypes = constructor.getGenericParameterTypes();
    Object[] arguments = new Object[parameterTypes.length];
    for (int i = 0; i < parameterTypes.length; i++) {
      arguments[i] = resolve(ServiceKey.of(parameterTypes[i]));
    }
    try {
      return constructor.newInstance(arguments);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.FINE, "Constructor of " + type.getName() + " failed", cause);
      throw new ServiceResolutionException("Failed to create " + type.getName(), cause);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new ServiceResolutionException("Failed to create " + type.getName(), e);
    }
  }

  private Constructor<?> selectConstructor(Class<?> type) {
    Constructor<?>[] candidates = type.getDeclaredConstructors();
    Arrays.sort(candidates, Comparator.comparingInt(Constructor<?>::getParameterCount).reversed());
    for (Constructor<?> candidate : candidates) {
      if (isSatisfiable(candidate)) {
        candidate.setAccessible(true);
        return candidate;
      }
    }
    throw new ServiceResolutionException("No constructor of " + type.getName()
        + " has all of its parameter types registered");
  }

  private boolean isSatisfiable(Constructor<?> constructor) {
    for (Type parameterType : constructor.getGenericParameterTypes()) {
      ServiceKey key;
      try {
        key = ServiceKey.of(parameterType);
      } catch (IllegalArgumentException e) {
        return false;
      }
      if (!registrations.containsKey(key)) {
        return false;
      }
    }
    return true;
  }

  private static final class Registration {
    private final Class<?> type;
    private final Object instance;

    private Registration(Class<?> type, Object instance) {
      this.type = type;
      this.instance = instance;
    }
  }
}
