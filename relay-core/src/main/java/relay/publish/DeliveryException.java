package relay.publish;

/**
 * Thrown when an outbox event could not be handed to the fanout at all, for example
 * because its stored payload cannot be decoded. The dispatcher schedules a retry.
 *
 * <p>A failed write to a single socket is not a delivery failure.
 */
public class DeliveryException extends Exception {

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
