package mediator.registry;

import mediator.Mediator;
import mediator.RequestHandler;
import mediator.dispatch.DefaultMediator;
import mediator.spi.ServiceKey;
import mediator.spi.ServiceRegistry;
import mediator.util.GenericTypes;

import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discovers {@link RequestHandler} implementations among candidate classes and registers each
 * one as a transient service under its {@code RequestHandler<Q, R>} key.
 *
 * <p>Candidates that are not concrete, instantiable classes are skipped silently: interfaces,
 * abstract classes, enums, annotations, anonymous, local and non-static inner classes. So are
 * classes that do not implement the capability, and handlers whose request or response type
 * stays generic.
 *
 * <h2>Duplicates</h2>
 * <p>Registering the same class for a key again is a no-op. A different class for a key that
 * already has one fails with {@link DuplicateHandlerException}, unless the registrar was created
 * with {@code allowOverride}, in which case the later class replaces the earlier one.
 *
 * <pre>{@code
 * HandlerRegistrar registrar = new HandlerRegistrar(container);
 * registrar.registerMediator();
 * registrar.registerHandlers(List.of(GetUserHandler.class, DeleteUserHandler.class));
 * }</pre>
 *
 * @see mediator.Mediators
 */
public final class HandlerRegistrar {
  private static final Logger logger = Logger.getLogger(HandlerRegistrar.class.getName());

  private final ServiceRegistry registry;
  private final boolean allowOverride;

  public HandlerRegistrar(ServiceRegistry registry) {
    this(registry, false);
  }

  /**
   * Creates a registrar.
   *
   * @param registry the container to register into
   * @param allowOverride whether a later handler class may replace an earlier one for the same
   *     request/response pair
   */
  public HandlerRegistrar(ServiceRegistry registry, boolean allowOverride) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.allowOverride = allowOverride;
  }

  /**
   * Registers {@link DefaultMediator} as the transient {@link Mediator}, unless the container
   * already has a mediator.
   */
  public void registerMediator() {
    ServiceKey key = ServiceKey.of(Mediator.class);
    Class<?> existing = registry.implementationTypeFor(key);
    if (existing != null) {
      logger.log(Level.FINE, "Keeping registered mediator {0}", existing.getName());
      return;
    }
    registry.addTransient(key, DefaultMediator.class);
  }

  /**
   * Registers every handler capability found among the candidates, in candidate order.
   *
   * @param candidateTypes the classes to inspect
   * @return the handler keys registered or confirmed by this call
   * @throws IllegalArgumentException if {@code candidateTypes} is null or empty
   * @throws DuplicateHandlerException if two classes handle the same pair and overriding is off
   */
  public List<ServiceKey> registerHandlers(Collection<? extends Class<?>> candidateTypes) {
    if (candidateTypes == null || candidateTypes.isEmpty()) {
      throw new IllegalArgumentException("At least one type must be provided to scan for handlers");
    }
    List<ServiceKey> registered = new ArrayList<>();
    for (Class<?> candidate : candidateTypes) {
      Objects.requireNonNull(candidate, "candidate type");
      if (!isInstantiable(candidate)) {
        continue;
      }
      for (ServiceKey key : capabilitiesOf(candidate)) {
        register(key, candidate);
        registered.add(key);
      }
    }
    logger.log(Level.INFO, "Registered {0} request handler(s) from {1} candidate type(s)",
        new Object[] {registered.size(), candidateTypes.size()});
    return Collections.unmodifiableList(registered);
  }

  /**
   * Returns the handler keys a class implements.
   *
   * <p>Java allows a class to implement {@link RequestHandler} with one parameterization only, so
   * the list holds at most one key today; callers treat each entry independently.
   *
   * @param type the class to inspect
   * @return the keys, empty if the class is not a resolvable handler
   */
  public static List<ServiceKey> capabilitiesOf(Class<?> type) {
    Type[] arguments = GenericTypes.resolveTypeArguments(type, RequestHandler.class);
    if (arguments == null) {
      return List.of();
    }
    Class<?> requestType = GenericTypes.rawClass(arguments[0]);
    Type responseType = arguments[1];
    if (requestType == null || !GenericTypes.isFullyResolved(responseType)) {
      logger.log(Level.FINE, "Skipping {0}: request or response type is not resolvable",
          type.getName());
      return List.of();
    }
    return List.of(ServiceKey.forHandler(requestType, responseType));
  }

  static boolean isInstantiable(Class<?> type) {
    if (type.isInterface() || type.isArray() || type.isPrimitive() || type.isEnum()
        || type.isAnonymousClass() || type.isLocalClass() || type.isSynthetic()) {
      return false;
    }
    int modifiers = type.getModifiers();
    if (Modifier.isAbstract(modifiers)) {
      return false;
    }
    return !type.isMemberClass() || Modifier.isStatic(modifiers);
  }

  private void register(ServiceKey key, Class<?> implementationType) {
    Class<?> existing = registry.implementationTypeFor(key);
    if (existing == implementationType) {
      return;
    }
    if (existing != null) {
      if (!allowOverride) {
        throw new DuplicateHandlerException(key, existing, implementationType);
      }
      logger.log(Level.WARNING, "Replacing handler {0} with {1} for {2}",
          new Object[] {existing.getName(), implementationType.getName(), key});
    }
    registry.addTransient(key, implementationType);
    logger.log(Level.FINE, "Registered {0} for {1}", new Object[] {implementationType.getName(), key});
  }
}
