package mediator.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import mediator.dispatch.DefaultMediator;
import mediator.micrometer.MicrometerMetricsExporter;
import mediator.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes the dispatch outcomes of scanned mediators to Micrometer.
 *
 * <p>The {@link DefaultMediator} registered by handler scanning is a prototype bean built through
 * constructor autowiring. Once a {@link MetricsExporter} bean exists the
 * {@code (ServiceProvider, MetricsExporter)} constructor is the greediest one that can be
 * satisfied, so every mediator obtained from the context records to it. Without an exporter the
 * mediators record nothing.
 *
 * <p>Meters are named {@code <prefix>.dispatch.success|failure|cancelled|unroutable} and
 * {@code <prefix>.handler.duration.ms}, with the prefix taken from
 * {@code mediator.metrics.name-prefix}. A blank prefix, or one ending in a dot, fails startup.
 * The exporter removes its meters when the context closes.
 */
@AutoConfiguration(before = MediatorAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "mediator.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(MediatorProperties.class)
public class MediatorMicrometerAutoConfiguration {

  /** Name of the exporter bean. */
  public static final String EXPORTER_BEAN_NAME = "mediatorMetricsExporter";

  @Bean(name = EXPORTER_BEAN_NAME)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter mediatorMetricsExporter(MeterRegistry meterRegistry,
      MediatorProperties properties) {
    String prefix = properties.getMetrics().getNamePrefix();
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("mediator.metrics.name-prefix must not be blank");
    }
    return new MicrometerMetricsExporter(meterRegistry, prefix.trim());
  }
}
