/**
 * Root API for relay: a transactional event outbox with in-process WebSocket fanout for a
 * messaging backend.
 *
 * <h2>Core Design</h2>
 * <p>A message send runs the {@linkplain relay.sequence.MessageSequencer sequencer} and the
 * {@link relay.OutboxWriter} in the caller's transaction, so the message, its per-conversation
 * {@code seq} and its outbox events commit or roll back together. A single
 * {@linkplain relay.dispatch.OutboxDispatcher dispatcher} thread polls committed, unpublished
 * events oldest first and hands each to the {@linkplain relay.publish.FanoutPublisher
 * publisher}, which writes one frame to every connection the
 * {@linkplain relay.registry.ConnectionRegistry registry} lists for the event's conversation.
 * Failed deliveries are retried with capped exponential backoff and are never dropped.
 *
 * <p>Socket delivery is best effort. Clients that miss frames recover through a history read
 * keyed by {@code seq}; the outbox guarantees an attempt, not receipt.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>relay-core</b> - write path, dispatcher, registry, protocol engine, publisher</li>
 *   <li><b>relay-jdbc</b> - JDBC stores, manual transactions, H2 and PostgreSQL schemas</li>
 *   <li><b>relay-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>relay-spring-adapter</b> - Spring-managed transaction integration</li>
 *   <li><b>relay-spring-boot-starter</b> - auto-configuration and the WebSocket endpoint</li>
 * </ul>
 *
 * @see relay.Relay
 * @see relay.MessageSender
 * @see relay.OutboxWriter
 */
package relay;
