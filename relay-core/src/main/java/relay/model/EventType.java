package relay.model;

/**
 * Kinds of realtime events written to the outbox and pushed to subscribers.
 *
 * <p>The {@link #wireName()} is what is stored in the {@code event_type} column and sent
 * as the {@code type} field of the event frame.
 */
public enum EventType {
  MESSAGE_CREATED("message.created"),
  CONVERSATION_UPDATED("conversation.updated");

  private final String wireName;

  EventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a stored or transmitted name back to its constant.
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static EventType fromWireName(String wireName) {
    for (EventType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown event type: " + wireName);
  }
}
