package mediator.spring.boot;

import mediator.spi.ServiceProvider;
import mediator.spring.BeanFactoryServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.beans.factory.support.AbstractBeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.BeanDefinitionRegistryPostProcessor;
import org.springframework.beans.factory.support.RootBeanDefinition;

/**
 * Registers a {@link BeanFactoryServiceProvider} once all configuration has been read, unless the
 * context already defines a {@link ServiceProvider}.
 *
 * <p>Scanning with {@link MediatorScan} may run before the application's own provider bean or
 * the auto-configured one is known, so the decision waits for this post-processor.
 */
public class ServiceProviderFallbackRegistrar implements BeanDefinitionRegistryPostProcessor {
    private static final Logger log = LoggerFactory.getLogger(ServiceProviderFallbackRegistrar.class);

    static final String BEAN_NAME = "mediatorServiceProviderFallbackRegistrar";

    static void registerIfAbsent(BeanDefinitionRegistry registry) {
        if (!registry.containsBeanDefinition(BEAN_NAME)) {
            RootBeanDefinition definition = new RootBeanDefinition(ServiceProviderFallbackRegistrar.class);
            definition.setRole(BeanDefinition.ROLE_INFRASTRUCTURE);
            registry.registerBeanDefinition(BEAN_NAME, definition);
        }
    }

    @Override
    public void postProcessBeanDefinitionRegistry(BeanDefinitionRegistry registry) throws BeansException {
        if (registry.containsBeanDefinition(MediatorHandlerScanner.SERVICE_PROVIDER_BEAN_NAME)) {
            return;
        }
        if (registry instanceof ListableBeanFactory beanFactory
                && beanFactory.getBeanNamesForType(ServiceProvider.class, true, false).length > 0) {
            return;
        }
        RootBeanDefinition provider = new RootBeanDefinition(BeanFactoryServiceProvider.class);
        provider.setAutowireMode(AbstractBeanDefinition.AUTOWIRE_CONSTRUCTOR);
        registry.registerBeanDefinition(MediatorHandlerScanner.SERVICE_PROVIDER_BEAN_NAME, provider);
        log.debug("No ServiceProvider bean defined; registered {}", MediatorHandlerScanner.SERVICE_PROVIDER_BEAN_NAME);
    }

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) throws BeansException {
    }
}
