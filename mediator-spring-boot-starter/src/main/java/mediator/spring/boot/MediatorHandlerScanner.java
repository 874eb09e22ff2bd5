package mediator.spring.boot;

import mediator.RequestHandler;
import mediator.registry.HandlerRegistrar;
import mediator.spi.ServiceKey;
import mediator.spring.BeanDefinitionServiceRegistry;
import mediator.spring.BeanFactoryServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds {@link RequestHandler} classes under base packages and registers them, together with the
 * mediator, as bean definitions. A {@link BeanFactoryServiceProvider} is added later by
 * {@link ServiceProviderFallbackRegistrar} when the context defines no other provider.
 *
 * <p>Shared by {@link MediatorScan} and the {@code mediator.base-packages} property.
 */
public class MediatorHandlerScanner {
    private static final Logger log = LoggerFactory.getLogger(MediatorHandlerScanner.class);

    /** Name of the {@link BeanFactoryServiceProvider} bean the starter registers. */
    public static final String SERVICE_PROVIDER_BEAN_NAME = "mediatorServiceProvider";

    private final Environment environment;
    private final ResourceLoader resourceLoader;

    public MediatorHandlerScanner(Environment environment, ResourceLoader resourceLoader) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    }

    /**
     * Scans the packages and registers what it finds.
     *
     * @param registry      the bean definition registry of the application context
     * @param basePackages  the packages to scan
     * @param allowOverride whether a later handler may replace an earlier one for the same pair
     * @return the handler keys registered
     * @throws IllegalArgumentException if no packages are given
     */
    public List<ServiceKey> register(BeanDefinitionRegistry registry, Collection<String> basePackages,
            boolean allowOverride) {
        Set<String> packages = new LinkedHashSet<>();
        if (basePackages != null) {
            for (String basePackage : basePackages) {
                if (basePackage != null && !basePackage.isBlank()) {
                    packages.add(basePackage.trim());
                }
            }
        }
        if (packages.isEmpty()) {
            throw new IllegalArgumentException("At least one package must be provided to scan for handlers");
        }

        ServiceProviderFallbackRegistrar.registerIfAbsent(registry);

        HandlerRegistrar registrar = new HandlerRegistrar(new BeanDefinitionServiceRegistry(registry), allowOverride);
        registrar.registerMediator();

        List<Class<?>> candidates = scan(packages);
        if (candidates.isEmpty()) {
            log.warn("No request handlers found in {}", packages);
            return List.of();
        }
        List<ServiceKey> keys = registrar.registerHandlers(candidates);
        log.info("Registered {} request handler(s) from packages {}", keys.size(), packages);
        return keys;
    }

    List<Class<?>> scan(Collection<String> packages) {
        ClassPathScanningCandidateComponentProvider provider =
                new ClassPathScanningCandidateComponentProvider(false, environment);
        provider.setResourceLoader(resourceLoader);
        provider.addIncludeFilter(new AssignableTypeFilter(RequestHandler.class));

        ClassLoader classLoader = resourceLoader.getClassLoader();
        List<Class<?>> found = new ArrayList<>();
        for (String basePackage : packages) {
            for (BeanDefinition candidate : provider.findCandidateComponents(basePackage)) {
                Class<?> type = ClassUtils.resolveClassName(candidate.getBeanClassName(), classLoader);
                if (!found.contains(type)) {
                    found.add(type);
                }
            }
        }
        found.sort(Comparator.comparing(Class::getName));
        return found;
    }
}
