package mediator.registry;

import mediator.spi.ServiceKey;

/**
 * Thrown when a second handler class is registered for a request/response pair that already has
 * one and overriding is not allowed.
 */
public class DuplicateHandlerException extends IllegalStateException {

  private final ServiceKey handlerKey;
  private final Class<?> existingType;
  private final Class<?> duplicateType;

  public DuplicateHandlerException(ServiceKey handlerKey, Class<?> existingType,
      Class<?> duplicateType) {
    super("Handler " + duplicateType.getName() + " conflicts with " + existingType.getName()
        + " for " + handlerKey);
    this.handlerKey = handlerKey;
    this.existingType = existingType;
    this.duplicateType = duplicateType;
  }

  public ServiceKey handlerKey() {
    return handlerKey;
  }

  public Class<?> existingType() {
    return existingType;
  }

  public Class<?> duplicateType() {
    return duplicateType;
  }
}
