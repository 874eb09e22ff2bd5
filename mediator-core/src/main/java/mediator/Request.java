package mediator;

/**
 * A request that a {@link Mediator} routes to exactly one {@link RequestHandler}.
 *
 * <p>The type argument names the response the request produces. Implementations should be
 * immutable and bind {@code R} to a concrete type, since the mediator reads it from the
 * request class to find the matching handler:
 *
 * <pre>{@code
 * public record GetUser(String id) implements Request<UserDto> {}
 * public record DeleteUser(String id) implements Request<Unit> {}
 * }</pre>
 *
 * @param <R> the response type
 * @see RequestHandler
 * @see Unit
 */
public interface Request<R> {
}
