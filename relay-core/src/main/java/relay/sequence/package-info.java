/**
 * Per-conversation sequence allocation with idempotent message insert.
 */
package relay.sequence;
