/**
 * Spring transaction integration for the relay write path.
 *
 * @see relay.spring.SpringTxContext
 */
package relay.spring;
