/**
 * Value types shared by the write path, the dispatcher and the fanout side.
 */
package relay.model;
