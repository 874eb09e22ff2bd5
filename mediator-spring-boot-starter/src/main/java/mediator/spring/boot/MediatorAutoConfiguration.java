package mediator.spring.boot;

import mediator.Mediator;
import mediator.spi.ServiceProvider;
import mediator.spring.BeanFactoryServiceProvider;

import org.springframework.beans.factory.BeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ResourceLoader;

/**
 * Auto-configuration for the mediator.
 *
 * <p>Provides the Spring-backed {@link ServiceProvider} and, when {@code mediator.base-packages}
 * is set, scans those packages for handlers and registers the {@link Mediator}. Applications
 * can use {@link MediatorScan} instead of the property.
 *
 * @see MediatorProperties
 * @see MediatorMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Mediator.class)
@EnableConfigurationProperties(MediatorProperties.class)
public class MediatorAutoConfiguration {

  @Bean(name = MediatorHandlerScanner.SERVICE_PROVIDER_BEAN_NAME)
  @ConditionalOnMissingBean(ServiceProvider.class)
  public BeanFactoryServiceProvider mediatorServiceProvider(BeanFactory beanFactory) {
    return new BeanFactoryServiceProvider(beanFactory);
  }

  @Bean
  public static MediatorPackageScanner mediatorPackageScanner(Environment environment,
      ResourceLoader resourceLoader) {
    return new MediatorPackageScanner(environment, resourceLoader);
  }
}
