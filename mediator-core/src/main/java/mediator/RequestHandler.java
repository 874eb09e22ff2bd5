package mediator;

import java.util.concurrent.CompletionStage;

/**
 * Handles one request type and produces its response asynchronously.
 *
 * <p>Exactly one handler may be registered per {@code (Q, R)} pair. Handlers are created by the
 * service container, typically a fresh instance per dispatch, so they should not rely on
 * instance state surviving between calls.
 *
 * <p>Handlers that observe {@code cancellationToken} should stop with a
 * {@link java.util.concurrent.CancellationException}, most simply via
 * {@link CancellationToken#throwIfCancellationRequested()}. The mediator reports that as a
 * cancelled outcome rather than a failure.
 *
 * <pre>{@code
 * public class GetUserHandler implements RequestHandler<GetUser, UserDto> {
 *   public CompletionStage<UserDto> handle(GetUser request, CancellationToken token) {
 *     token.throwIfCancellationRequested();
 *     return CompletableFuture.completedFuture(new UserDto(request.id()));
 *   }
 * }
 * }</pre>
 *
 * @param <Q> the request type
 * @param <R> the response type
 */
public interface RequestHandler<Q extends Request<R>, R> {

  /**
   * Handles a request.
   *
   * @param request the request, never {@code null}
   * @param cancellationToken the caller's cancellation signal
   * @return a stage completing with the response
   * @throws Exception if the handler fails before producing a stage
   */
  CompletionStage<R> handle(Q request, CancellationToken cancellationToken) throws Exception;
}
