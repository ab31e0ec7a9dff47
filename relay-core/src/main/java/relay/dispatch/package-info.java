/**
 * Outbox polling loop with unbounded, backoff-spaced retries.
 *
 * @see relay.dispatch.OutboxDispatcher
 * @see relay.dispatch.RetryPolicy
 */
package relay.dispatch;
