package relay.publish;

/**
 * Per-event fanout statistics.
 *
 * @param recipients sessions subscribed to the conversation at snapshot time
 * @param delivered  sessions the frame was written to
 * @param dropped    sessions deregistered because the write failed
 */
public record DeliveryOutcome(int recipients, int delivered, int dropped) {

  public static final DeliveryOutcome NO_RECIPIENTS = new DeliveryOutcome(0, 0, 0);
}
