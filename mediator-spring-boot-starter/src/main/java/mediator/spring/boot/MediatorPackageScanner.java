package mediator.spring.boot;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.BeanDefinitionRegistryPostProcessor;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ResourceLoader;

import java.util.Objects;

/**
 * Registers the handlers under {@code mediator.base-packages} before any bean is created.
 *
 * <p>Properties are bound directly from the {@link Environment} because post-processors run
 * ahead of {@link MediatorProperties} binding. Does nothing when the property is absent.
 */
public class MediatorPackageScanner implements BeanDefinitionRegistryPostProcessor {

    static final String BASE_PACKAGES_PROPERTY = "mediator.base-packages";

    private final Environment environment;
    private final ResourceLoader resourceLoader;

    public MediatorPackageScanner(Environment environment, ResourceLoader resourceLoader) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    }

    @Override
    public void postProcessBeanDefinitionRegistry(BeanDefinitionRegistry registry) throws BeansException {
        MediatorProperties props = Binder.get(environment)
                .bind("mediator", Bindable.of(MediatorProperties.class))
                .orElseGet(MediatorProperties::new);
        if (props.getBasePackages().isEmpty() && !environment.containsProperty(BASE_PACKAGES_PROPERTY)) {
            return;
        }
        new MediatorHandlerScanner(environment, resourceLoader)
                .register(registry, props.getBasePackages(), props.isAllowHandlerOverride());
    }

    @Override
    public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory) throws BeansException {
    }
}
