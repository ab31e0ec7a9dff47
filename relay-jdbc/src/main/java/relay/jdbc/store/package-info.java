/**
 * Portable JDBC stores for outbox rows, messages, counters and membership.
 */
package relay.jdbc.store;
