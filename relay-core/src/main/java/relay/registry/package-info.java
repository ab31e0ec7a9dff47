/**
 * Process-wide index of live connections and their subscriptions.
 *
 * @see relay.registry.ConnectionRegistry
 */
package relay.registry;
