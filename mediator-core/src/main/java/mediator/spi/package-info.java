/**
 * Service provider interfaces: the container the mediator resolves handlers from, and the
 * metrics hook.
 *
 * <ul>
 *   <li>{@link mediator.spi.ServiceProvider}: resolves instances by {@link mediator.spi.ServiceKey}</li>
 *   <li>{@link mediator.spi.ServiceRegistry}: records registrations at composition time</li>
 *   <li>{@link mediator.spi.MetricsExporter}: dispatch outcome counters</li>
 * </ul>
 */
package mediator.spi;
