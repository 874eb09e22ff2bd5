package mediator.container;

/**
 * Thrown when {@link DefaultServiceContainer} cannot create a registered service.
 */
public class ServiceResolutionException extends RuntimeException {

  public ServiceResolutionException(String message) {
    super(message);
  }

  public ServiceResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
