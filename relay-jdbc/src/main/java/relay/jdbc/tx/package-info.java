/**
 * Manual JDBC transactions bound to the calling thread.
 */
package relay.jdbc.tx;
