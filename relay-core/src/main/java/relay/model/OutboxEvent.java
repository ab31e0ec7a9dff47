package relay.model;

import java.time.Instant;

/**
 * One row of the realtime outbox table.
 *
 * <p>{@code payloadJson} holds {@code {"seq":..,"occurred_at":..,"payload":{..}}}. A row
 * is pending while {@code publishedAt} is {@code null}.
 *
 * @param eventId       monotonic ULID, also the ordering tie-breaker
 * @param eventType     stored wire name of the {@link EventType}
 * @param conversationId routing key for fanout
 * @param payloadJson   serialized event body
 * @param createdAt     commit-side creation time
 * @param publishedAt   time of successful delivery, or {@code null}
 * @param attempts      failed delivery attempts so far
 * @param nextAttemptAt earliest time the dispatcher may pick the row up
 * @param lastError     message of the last delivery failure, or {@code null}
 */
public record OutboxEvent(
    String eventId,
    String eventType,
    String conversationId,
    String payloadJson,
    Instant createdAt,
    Instant publishedAt,
    int attempts,
    Instant nextAttemptAt,
    String lastError
) {

  public boolean isPending() {
    return publishedAt == null;
  }
}
