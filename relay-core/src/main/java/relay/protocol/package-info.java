/**
 * Realtime wire protocol: typed inbound commands and outbound frames, the JSON codec,
 * per-connection rate limiting and the connection state machine.
 *
 * <h2>Inbound</h2>
 * <pre>{@code
 * {"op":"subscribe","conversation_ids":["c1","c2"]}
 * {"op":"unsubscribe","conversation_ids":["c1"]}
 * {"op":"ping","ts":1700000000}
 * }</pre>
 *
 * <h2>Outbound</h2>
 * <pre>{@code
 * {"type":"connection.welcome","connection_id":..,"user_id":..,"server_time":..,"heartbeat_sec":25,"protocol_version":1}
 * {"type":"ack","op":"subscribe","ok":false,"accepted":["c1"],"rejected":["c2"]}
 * {"type":"pong","ts":1700000000}
 * {"type":"error","error":{"code":"FORBIDDEN_CONVERSATION","message":..,"details":{..}}}
 * {"type":"message.created","event_id":..,"conversation_id":..,"seq":1,"occurred_at":..,"payload":{..}}
 * }</pre>
 *
 * @see relay.protocol.ProtocolEngine
 */
package relay.protocol;
