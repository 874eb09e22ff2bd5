package mediator.spring;

import mediator.spi.ServiceKey;
import mediator.spi.ServiceRegistry;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.support.AbstractBeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.RootBeanDefinition;
import org.springframework.core.ResolvableType;

import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * {@link ServiceRegistry} that registers services as Spring bean definitions, for use while the
 * application context is still being configured.
 *
 * <p>Transient services become prototype beans with constructor autowiring, named after their
 * implementation class. Registering a transient for a key that already has beans replaces them.
 *
 * @see BeanFactoryServiceProvider
 */
public final class BeanDefinitionServiceRegistry implements ServiceRegistry {
  private final BeanDefinitionRegistry registry;
  private final ListableBeanFactory beanFactory;

  /**
   * Creates a registry over a bean definition registry that can also answer type lookups, such
   * as the {@code DefaultListableBeanFactory} of an application context.
   *
   * @param registry the bean definition registry
   * @throws IllegalArgumentException if {@code registry} is not a {@link ListableBeanFactory}
   */
  public BeanDefinitionServiceRegistry(BeanDefinitionRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    if (!(registry instanceof ListableBeanFactory listable)) {
      throw new IllegalArgumentException("Bean definition registry " + registry.getClass().getName()
          + " must also be a " + ListableBeanFactory.class.getSimpleName());
    }
    this.beanFactory = listable;
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
    for (String existing : beanNamesFor(key)) {
      registry.removeBeanDefinition(existing);
    }
    RootBeanDefinition definition = new RootBeanDefinition(implementationType);
    definition.setScope(BeanDefinition.SCOPE_PROTOTYPE);
    definition.setAutowireMode(AbstractBeanDefinition.AUTOWIRE_CONSTRUCTOR);
    registry.registerBeanDefinition(implementationType.getName(), definition);
  }

  @Override
  @SuppressWarnings({"unchecked", "rawtypes"})
  public void addSingleton(ServiceKey key, Object instance) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(instance, "instance");
    if (!key.serviceType().isInstance(instance)) {
      throw new IllegalArgumentException(instance.getClass().getName() + " does not implement "
          + key.serviceType().getName());
    }
    RootBeanDefinition definition = new RootBeanDefinition((Class) instance.getClass(), () -> instance);
    registry.registerBeanDefinition(instance.getClass().getName(), definition);
  }

  @Override
  public Class<?> implementationTypeFor(ServiceKey key) {
    String[] names = beanNamesFor(key);
    if (names.length == 0) {
      return null;
    }
    return beanFactory.getType(names[0], false);
  }

  private String[] beanNamesFor(ServiceKey key) {
    ResolvableType type = BeanFactoryServiceProvider.toResolvableType(key);
    return beanFactory.getBeanNamesForType(type, true, false);
  }
}
