/**
 * Spring Boot auto-configuration for the mediator.
 *
 * <h2>Property-based scanning</h2>
 * <pre>{@code
 * mediator.base-packages=com.example.users,com.example.orders
 * mediator.allow-handler-override=false
 * mediator.metrics.enabled=true
 * mediator.metrics.name-prefix=mediator
 * }</pre>
 *
 * <h2>Annotation-based scanning</h2>
 * <pre>{@code
 * @SpringBootApplication
 * @MediatorScan("com.example.users")
 * public class Application { }
 * }</pre>
 *
 * <p>Either way, inject {@link mediator.Mediator} wherever requests are sent.
 */
package mediator.spring.boot;
