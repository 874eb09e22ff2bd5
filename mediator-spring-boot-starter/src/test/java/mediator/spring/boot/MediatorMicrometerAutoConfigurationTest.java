package mediator.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import mediator.HandlerNotFoundException;
import mediator.Mediator;
import mediator.Request;
import mediator.micrometer.MicrometerMetricsExporter;
import mediator.spi.MetricsExporter;
import mediator.spring.boot.sample.Greet;
import mediator.spring.boot.sample.GreetingFormatter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediatorMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    MediatorMicrometerAutoConfiguration.class, MediatorAutoConfiguration.class))
            .withUserConfiguration(FormatterConfig.class)
            .withPropertyValues("mediator.base-packages=mediator.spring.boot.sample");

    // ── Mediator wiring ─────────────────────────────────────────────

    @Test
    void scannedMediatorCountsSuccessfulDispatch() {
        runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
            assertInstanceOf(MicrometerMetricsExporter.class,
                    ctx.getBean(MediatorMicrometerAutoConfiguration.EXPORTER_BEAN_NAME));

            ctx.getBean(Mediator.class).send(new Greet("Ann")).get(1, TimeUnit.SECONDS);
            ctx.getBean(Mediator.class).send(new Greet("Bob")).get(1, TimeUnit.SECONDS);

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertEquals(2.0, registry.find("mediator.dispatch.success").counter().count());
            assertEquals(2, registry.find("mediator.handler.duration.ms").summary().count());
        });
    }

    @Test
    void scannedMediatorCountsUnroutableRequest() {
        runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
            Mediator mediator = ctx.getBean(Mediator.class);
            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> mediator.send(new Unrouted()).get(1, TimeUnit.SECONDS));
            assertInstanceOf(HandlerNotFoundException.class, ex.getCause());

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.find("mediator.dispatch.unroutable").counter().count());
            assertEquals(0.0, registry.find("mediator.dispatch.success").counter().count());
        });
    }

    @Test
    void applicationExporterReplacesMicrometer() {
        runner.withUserConfiguration(MeterRegistryConfig.class, CountingExporterConfig.class).run(ctx -> {
            assertFalse(ctx.containsBean(MediatorMicrometerAutoConfiguration.EXPORTER_BEAN_NAME));

            ctx.getBean(Mediator.class).send(new Greet("Ann")).get(1, TimeUnit.SECONDS);

            assertEquals(1, ctx.getBean(CountingExporter.class).success.get());
            assertNull(ctx.getBean(MeterRegistry.class).find("mediator.dispatch.success").counter());
        });
    }

    @Test
    void mediatorDispatchesWithoutMeterRegistry() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertFalse(ctx.containsBean(MediatorMicrometerAutoConfiguration.EXPORTER_BEAN_NAME));
            assertEquals("Hello, Ann", ctx.getBean(Mediator.class).send(new Greet("Ann")).get(1, TimeUnit.SECONDS));
        });
    }

    @Test
    void disablingMetricsLeavesRegistryUntouched() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("mediator.metrics.enabled=false")
                .run(ctx -> {
                    ctx.getBean(Mediator.class).send(new Greet("Ann")).get(1, TimeUnit.SECONDS);
                    assertTrue(ctx.getBean(MeterRegistry.class).getMeters().isEmpty());
                });
    }

    // ── Name prefix ─────────────────────────────────────────────────

    @Test
    void metersUseConfiguredPrefix() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("mediator.metrics.name-prefix=orders.mediator")
                .run(ctx -> {
                    ctx.getBean(Mediator.class).send(new Greet("Ann")).get(1, TimeUnit.SECONDS);
                    MeterRegistry registry = ctx.getBean(MeterRegistry.class);
                    assertEquals(1.0, registry.find("orders.mediator.dispatch.success").counter().count());
                    assertNull(registry.find("mediator.dispatch.success").counter());
                });
    }

    @Test
    void blankPrefixFailsStartup() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("mediator.metrics.name-prefix=   ")
                .run(ctx -> {
                    assertNotNull(ctx.getStartupFailure());
                    assertTrue(TestFailures.hasCause(ctx.getStartupFailure(), IllegalArgumentException.class));
                });
    }

    @Test
    void prefixEndingInDotFailsStartup() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("mediator.metrics.name-prefix=orders.")
                .run(ctx -> {
                    assertNotNull(ctx.getStartupFailure());
                    assertTrue(TestFailures.hasCause(ctx.getStartupFailure(), IllegalArgumentException.class));
                });
    }

    // ── Shutdown ────────────────────────────────────────────────────

    @Test
    void closingContextRemovesDispatchMeters() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        runner.withBean(MeterRegistry.class, () -> registry)
                .run(ctx -> {
                    ctx.getBean(Mediator.class).send(new Greet("Ann")).get(1, TimeUnit.SECONDS);
                    assertNotNull(registry.find("mediator.dispatch.success").counter());
                });

        assertNull(registry.find("mediator.dispatch.success").counter());
        assertNull(registry.find("mediator.handler.duration.ms").summary());
    }

    record Unrouted() implements Request<String> {
    }

    static class CountingExporter implements MetricsExporter {
        final AtomicInteger success = new AtomicInteger();

        @Override
        public void incrementDispatchSuccess() {
            success.incrementAndGet();
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchCancelled() {
        }

        @Override
        public void incrementDispatchUnroutable() {
        }
    }

    @Configuration
    static class FormatterConfig {
        @Bean
        GreetingFormatter greetingFormatter() {
            return name -> "Hello, " + name;
        }
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CountingExporterConfig {
        @Bean
        CountingExporter countingExporter() {
            return new CountingExporter();
        }
    }
}
