package relay.publish;

import relay.model.OutboxEvent;

/**
 * Pushes a committed outbox event to the connections subscribed to its conversation.
 *
 * <p>Returning normally means the event counts as published, including when nobody was
 * subscribed. Throwing means the dispatcher retries it later.
 *
 * @see FanoutPublisher
 */
@FunctionalInterface
public interface Publisher {

  /**
   * @param event the pending outbox row
   * @return fanout statistics
   * @throws DeliveryException if the event could not be prepared for fanout
   */
  DeliveryOutcome deliver(OutboxEvent event) throws DeliveryException;
}
