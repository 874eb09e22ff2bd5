/**
 * Root API of the mediator: in-process routing of typed requests to exactly one handler.
 *
 * <h2>Core Design</h2>
 * <p>A {@link mediator.Request} names its response type; a {@link mediator.RequestHandler}
 * handles one {@code (request, response)} pair. At composition time a
 * {@linkplain mediator.registry.HandlerRegistrar registrar} records each handler in a service
 * container under the key {@code RequestHandler<Q, R>}. At call time the
 * {@linkplain mediator.dispatch.DefaultMediator mediator} resolves that key for the runtime class
 * of the request, invokes the handler once and returns its result as a
 * {@link java.util.concurrent.CompletableFuture}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>mediator-core</b>: API, dispatcher, registrar, default container (zero external deps)</li>
 *   <li><b>mediator-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>mediator-spring-boot-starter</b>: Spring container adapter and package scanning</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * public record Greet(String name) implements Request<String> {}
 *
 * public class GreetHandler implements RequestHandler<Greet, String> {
 *   public CompletionStage<String> handle(Greet request, CancellationToken token) {
 *     return CompletableFuture.completedFuture("Hello, " + request.name());
 *   }
 * }
 *
 * var container = Mediators.addMediator(new DefaultServiceContainer(), GreetHandler.class);
 * Mediator mediator = container.resolve(Mediator.class);
 * String greeting = mediator.send(new Greet("Ada")).join();
 * }</pre>
 *
 * @see mediator.Mediator
 * @see mediator.Mediators
 * @see mediator.Unit
 */
package mediator;
