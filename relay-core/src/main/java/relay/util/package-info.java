/**
 * Small shared helpers.
 */
package relay.util;
