/**
 * Service provider interfaces: persistence, transactions, credentials, membership and
 * metrics. The JDBC, Spring and Micrometer modules supply implementations.
 */
package relay.spi;
