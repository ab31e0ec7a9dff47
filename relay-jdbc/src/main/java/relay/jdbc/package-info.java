/**
 * JDBC persistence for relay: helpers, connection provider, stores and schemas.
 *
 * <p>DDL for H2 and PostgreSQL ships as classpath resources
 * {@code schema/h2.sql} and {@code schema/postgresql.sql}.
 *
 * @see relay.jdbc.store.JdbcOutboxStore
 * @see relay.jdbc.store.JdbcMessageStore
 * @see relay.jdbc.tx.JdbcTransactionManager
 */
package relay.jdbc;
