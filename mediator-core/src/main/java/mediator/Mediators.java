package mediator;

import mediator.registry.HandlerRegistrar;
import mediator.spi.ServiceRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Composition entry points: register the mediator and the handlers found among a set of classes
 * into a service container.
 *
 * <h2>Explicit handler types</h2>
 * <pre>{@code
 * DefaultServiceContainer container = Mediators.addMediator(new DefaultServiceContainer(),
 *     GetUserHandler.class, DeleteUserHandler.class);
 * Mediator mediator = container.resolve(Mediator.class);
 * }</pre>
 *
 * <h2>Marker type</h2>
 * <pre>{@code
 * // registers every handler nested in UserFeature
 * Mediators.addMediatorFrom(container, UserFeature.class);
 * }</pre>
 *
 * <p>Spring applications use {@code @MediatorScan} or the {@code mediator.base-packages}
 * property of the starter instead.
 *
 * @see HandlerRegistrar
 */
public final class Mediators {

  private Mediators() {
  }

  /**
   * Registers the mediator and every handler among {@code handlerTypes}.
   *
   * @param registry the container
   * @param handlerTypes the classes to scan
   * @param <T> the container type
   * @return {@code registry} for chaining
   * @throws IllegalArgumentException if no types are given
   */
  public static <T extends ServiceRegistry> T addMediator(T registry, Class<?>... handlerTypes) {
    if (handlerTypes == null || handlerTypes.length == 0) {
      throw new IllegalArgumentException("At least one type must be provided to scan for handlers");
    }
    return addMediator(registry, Arrays.asList(handlerTypes), false);
  }

  /**
   * Registers the mediator and every handler among {@code handlerTypes}.
   *
   * @param registry the container
   * @param handlerTypes the classes to scan
   * @param <T> the container type
   * @return {@code registry} for chaining
   * @throws IllegalArgumentException if no types are given
   */
  public static <T extends ServiceRegistry> T addMediator(T registry,
      Collection<? extends Class<?>> handlerTypes) {
    return addMediator(registry, handlerTypes, false);
  }

  /**
   * Registers the mediator and every handler among {@code handlerTypes}.
   *
   * @param registry the container
   * @param handlerTypes the classes to scan
   * @param allowOverride whether a later handler may replace an earlier one for the same pair
   * @param <T> the container type
   * @return {@code registry} for chaining
   * @throws IllegalArgumentException if no types are given
   */
  public static <T extends ServiceRegistry> T addMediator(T registry,
      Collection<? extends Class<?>> handlerTypes, boolean allowOverride) {
    Objects.requireNonNull(registry, "registry");
    if (handlerTypes == null || handlerTypes.isEmpty()) {
      throw new IllegalArgumentException("At least one type must be provided to scan for handlers");
    }
    HandlerRegistrar registrar = new HandlerRegistrar(registry, allowOverride);
    registrar.registerMediator();
    registrar.registerHandlers(handlerTypes);
    return registry;
  }

  /**
   * Registers the mediator and every handler declared inside {@code marker}, at any nesting
   * depth, plus {@code marker} itself.
   *
   * @param registry the container
   * @param marker the class whose nested types are scanned
   * @param <T> the container type
   * @return {@code registry} for chaining
   */
  public static <T extends ServiceRegistry> T addMediatorFrom(T registry, Class<?> marker) {
    Objects.requireNonNull(marker, "marker");
    return addMediator(registry, typesDeclaredIn(marker), false);
  }

  static List<Class<?>> typesDeclaredIn(Class<?> marker) {
    List<Class<?>> types = new ArrayList<>();
    collect(marker, types);
    return types;
  }

  private static void collect(Class<?> type, List<Class<?>> into) {
    into.add(type);
    for (Class<?> nested : type.getDeclaredClasses()) {
      collect(nested, into);
    }
  }
}
