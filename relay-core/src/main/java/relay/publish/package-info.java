/**
 * Fanout of committed events to subscribed connections.
 */
package relay.publish;
