package mediator.spring.boot;

import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.AliasFor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers the mediator and every request handler found in the given packages.
 *
 * <pre>{@code
 * @Configuration
 * @MediatorScan(basePackageClasses = GetUserHandler.class)
 * public class AppConfig {
 * }
 * }</pre>
 *
 * <p>Handlers become prototype beans with constructor injection. At least one package must be
 * given; unlike {@code @ComponentScan} the declaring class's package is not implied.
 *
 * @see MediatorScanRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(MediatorScanRegistrar.class)
public @interface MediatorScan {

    /**
     * Alias for {@link #basePackages()}.
     */
    @AliasFor("basePackages")
    String[] value() default {};

    /**
     * Packages to scan for handlers, including sub-packages.
     */
    @AliasFor("value")
    String[] basePackages() default {};

    /**
     * Type-safe alternative to {@link #basePackages()}: the package of each class is scanned.
     */
    Class<?>[] basePackageClasses() default {};
}
