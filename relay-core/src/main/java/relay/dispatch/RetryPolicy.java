package relay.dispatch;

/**
 * Strategy for computing the delay before retrying a failed event delivery.
 *
 * <p>There is no attempt limit: an event is retried until it is published.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of failed attempts so far, including the one just made (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
