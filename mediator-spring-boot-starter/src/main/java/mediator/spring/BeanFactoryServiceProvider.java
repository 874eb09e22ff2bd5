package mediator.spring;

import mediator.spi.ServiceKey;
import mediator.spi.ServiceProvider;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.core.ResolvableType;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * {@link ServiceProvider} backed by a Spring {@link BeanFactory}.
 *
 * <p>Keys are translated into {@link ResolvableType}s, so {@code RequestHandler<GetUser, UserDto>}
 * matches exactly the beans whose class binds those generics. Prototype handler beans yield a
 * fresh instance on each resolution.
 *
 * @see BeanDefinitionServiceRegistry
 */
public final class BeanFactoryServiceProvider implements ServiceProvider {
  private final BeanFactory beanFactory;

  public BeanFactoryServiceProvider(BeanFactory beanFactory) {
    this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory");
  }

  /**
   * Resolves the unique bean matching the key.
   *
   * @param key the service key
   * @return the bean, or {@code null} if none matches
   * @throws org.springframework.beans.BeansException if several beans match or creation fails
   */
  @Override
  public Object resolve(ServiceKey key) {
    Objects.requireNonNull(key, "key");
    return beanFactory.getBeanProvider(toResolvableType(key)).getIfAvailable();
  }

  static ResolvableType toResolvableType(ServiceKey key) {
    if (key.typeArguments().isEmpty()) {
      return ResolvableType.forClass(key.serviceType());
    }
    ResolvableType[] generics = new ResolvableType[key.typeArguments().size()];
    int i = 0;
    for (Type argument : key.typeArguments()) {
      generics[i++] = ResolvableType.forType(argument);
    }
    return ResolvableType.forClassWithGenerics(key.serviceType(), generics);
  }
}
