package mediator.spring.boot;

import mediator.HandlerNotFoundException;
import mediator.Mediator;
import mediator.Request;
import mediator.Unit;
import mediator.container.DefaultServiceContainer;
import mediator.dispatch.DefaultMediator;
import mediator.registry.DuplicateHandlerException;
import mediator.spi.ServiceProvider;
import mediator.spring.BeanFactoryServiceProvider;
import mediator.spring.boot.duplicate.Ping;
import mediator.spring.boot.sample.Forget;
import mediator.spring.boot.sample.Greet;
import mediator.spring.boot.sample.GreetHandler;
import mediator.spring.boot.sample.GreetingFormatter;
import mediator.spring.boot.sample.Shout;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MediatorAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(MediatorAutoConfiguration.class))
      .withUserConfiguration(FormatterConfig.class);

  // ── Beans ───────────────────────────────────────────────────────

  @Test
  void providesServiceProviderWithoutScanning() {
    runner.run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertInstanceOf(BeanFactoryServiceProvider.class, ctx.getBean(ServiceProvider.class));
      assertEquals(0, ctx.getBeanNamesForType(Mediator.class).length);
    });
  }

  @Test
  void backsOffWhenServiceProviderPresent() {
    runner.withUserConfiguration(CustomProviderConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean(MediatorHandlerScanner.SERVICE_PROVIDER_BEAN_NAME));
      assertInstanceOf(DefaultServiceContainer.class, ctx.getBean(ServiceProvider.class));
    });
  }

  @Test
  void scanningUsesApplicationServiceProvider() {
    runner.withUserConfiguration(CustomProviderConfig.class)
        .withPropertyValues("mediator.base-packages=mediator.spring.boot.sample")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          assertArrayEquals(new String[] {"customServiceProvider"},
              ctx.getBeanNamesForType(ServiceProvider.class));
          Mediator mediator = ctx.getBean(Mediator.class);
          // the custom container holds no handlers, so the scanned ones are not visible to it
          ExecutionException ex = assertThrows(ExecutionException.class,
              () -> mediator.send(new Greet("Ann")).get(1, TimeUnit.SECONDS));
          assertInstanceOf(HandlerNotFoundException.class, ex.getCause());
        });
  }

  @Test
  void handlersArePrototypeBeans() {
    runner.withPropertyValues("mediator.base-packages=mediator.spring.boot.sample").run(ctx -> {
      assertInstanceOf(DefaultMediator.class, ctx.getBean(Mediator.class));
      assertNotSame(ctx.getBean(GreetHandler.class), ctx.getBean(GreetHandler.class));
    });
  }

  // ── Dispatch ────────────────────────────────────────────────────

  @Test
  void dispatchesToScannedHandler() {
    runner.withPropertyValues("mediator.base-packages=mediator.spring.boot.sample").run(ctx -> {
      Mediator mediator = ctx.getBean(Mediator.class);
      assertEquals("Hello, Ann", mediator.send(new Greet("Ann")).get(1, TimeUnit.SECONDS));
    });
  }

  @Test
  void handlerCanDispatchNestedRequest() {
    runner.withPropertyValues("mediator.base-packages=mediator.spring.boot.sample").run(ctx -> {
      Mediator mediator = ctx.getBean(Mediator.class);
      assertEquals("NESTED: HELLO, BOB", mediator.send(new Shout("Bob")).get(1, TimeUnit.SECONDS));
    });
  }

  @Test
  void commandReturnsUnit() {
    runner.withPropertyValues("mediator.base-packages=mediator.spring.boot.sample").run(ctx -> {
      Mediator mediator = ctx.getBean(Mediator.class);
      assertSame(Unit.VALUE, mediator.send(new Forget("Ann")).get(1, TimeUnit.SECONDS));
    });
  }

  @Test
  void unregisteredRequestFailsWithNotFound() {
    runner.withPropertyValues("mediator.base-packages=mediator.spring.boot.sample").run(ctx -> {
      Mediator mediator = ctx.getBean(Mediator.class);
      ExecutionException ex = assertThrows(ExecutionException.class,
          () -> mediator.send(new Unrouted()).get(1, TimeUnit.SECONDS));
      assertInstanceOf(HandlerNotFoundException.class, ex.getCause());
      assertTrue(ex.getCause().getMessage().contains(Unrouted.class.getName()));
    });
  }

  // ── Startup failures ────────────────────────────────────────────

  @Test
  void emptyBasePackagesFailsStartup() {
    runner.withPropertyValues("mediator.base-packages=").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertTrue(TestFailures.hasCause(ctx.getStartupFailure(), IllegalArgumentException.class));
    });
  }

  @Test
  void conflictingHandlersFailStartup() {
    runner.withPropertyValues("mediator.base-packages=mediator.spring.boot.duplicate").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertTrue(TestFailures.hasCause(ctx.getStartupFailure(), DuplicateHandlerException.class));
    });
  }

  @Test
  void overrideLetsLaterHandlerWin() {
    runner.withPropertyValues(
        "mediator.base-packages=mediator.spring.boot.duplicate",
        "mediator.allow-handler-override=true").run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertEquals("second", ctx.getBean(Mediator.class).send(new Ping()).get(1, TimeUnit.SECONDS));
    });
  }

  record Unrouted() implements Request<String> {
  }

  @Configuration
  static class FormatterConfig {
    @Bean
    GreetingFormatter greetingFormatter() {
      return name -> "Hello, " + name;
    }
  }

  @Configuration
  static class CustomProviderConfig {
    @Bean
    DefaultServiceContainer customServiceProvider() {
      return new DefaultServiceContainer();
    }
  }
}
