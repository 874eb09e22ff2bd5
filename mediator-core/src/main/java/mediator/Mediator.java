package mediator;

import java.util.concurrent.CompletableFuture;

/**
 * Routes a request to the single handler registered for it.
 *
 * <p>Outcomes are told apart by the shape of the returned future:
 * <ul>
 *   <li>completed normally with the handler's response</li>
 *   <li>failed with {@link HandlerNotFoundException} when nothing handles the request</li>
 *   <li>cancelled ({@link CompletableFuture#isCancelled()}) when the token fired or the handler
 *       stopped with a {@link java.util.concurrent.CancellationException}</li>
 *   <li>failed with the handler's own exception otherwise</li>
 * </ul>
 *
 * <p>A token that has already fired when {@code send} is called yields a cancelled future before
 * the handler is looked up, so no handler is created and neither not-found nor container
 * failures are reported.
 *
 * @see mediator.dispatch.DefaultMediator
 */
public interface Mediator {

  /**
   * Sends a request without a cancellation signal.
   *
   * @param request the request
   * @param <R> the response type
   * @return a future completing with the handler's response
   * @throws NullPointerException if {@code request} is null
   * @throws IllegalArgumentException if the request class does not bind its response type
   */
  default <R> CompletableFuture<R> send(Request<R> request) {
    return send(request, CancellationToken.NONE);
  }

  /**
   * Sends a request, reading the response type from the request class.
   *
   * @param request the request
   * @param cancellationToken the cancellation signal passed through to the handler
   * @param <R> the response type
   * @return a future completing with the handler's response
   * @throws NullPointerException if {@code request} or {@code cancellationToken} is null
   * @throws IllegalArgumentException if the request class does not bind its response type
   */
  <R> CompletableFuture<R> send(Request<R> request, CancellationToken cancellationToken);

  /**
   * Sends a request with an explicitly expected response type.
   *
   * <p>Needed for request classes that leave their response type generic. When the request
   * class does declare one, it must equal {@code responseType}.
   *
   * @param request the request
   * @param responseType the response type the caller expects
   * @param cancellationToken the cancellation signal passed through to the handler
   * @param <R> the response type
   * @return a future completing with the handler's response
   * @throws NullPointerException if any argument is null
   * @throws IllegalArgumentException if {@code responseType} differs from the declared one
   */
  <R> CompletableFuture<R> send(Request<R> request, Class<R> responseType,
      CancellationToken cancellationToken);
}
