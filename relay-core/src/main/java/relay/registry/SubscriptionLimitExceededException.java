package relay.registry;

/**
 * Thrown when a subscribe call would take a connection past its subscription limit.
 * Nothing from the rejected call is applied.
 */
public class SubscriptionLimitExceededException extends RuntimeException {
  private final int limit;
  private final int requestedTotal;

  public SubscriptionLimitExceededException(int limit, int requestedTotal) {
    super("Subscription limit " + limit + " exceeded (would have " + requestedTotal + ")");
    this.limit = limit;
    this.requestedTotal = requestedTotal;
  }

  public int limit() {
    return limit;
  }

  public int requestedTotal() {
    return requestedTotal;
  }
}
