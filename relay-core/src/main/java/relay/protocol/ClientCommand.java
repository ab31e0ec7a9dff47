package relay.protocol;

import java.util.List;
import java.util.Objects;

/**
 * Inbound commands accepted on an open connection.
 */
public sealed interface ClientCommand {

  /**
   * Value of the {@code op} field.
   */
  String op();

  /**
   * {@code {"op":"subscribe","conversation_ids":[...]}}
   */
  record Subscribe(List<String> conversationIds) implements ClientCommand {
    public Subscribe {
      conversationIds = List.copyOf(Objects.requireNonNull(conversationIds, "conversationIds"));
    }

    @Override
    public String op() {
      return "subscribe";
    }
  }

  /**
   * {@code {"op":"unsubscribe","conversation_ids":[...]}}
   */
  record Unsubscribe(List<String> conversationIds) implements ClientCommand {
    public Unsubscribe {
      conversationIds = List.copyOf(Objects.requireNonNull(conversationIds, "conversationIds"));
    }

    @Override
    public String op() {
      return "unsubscribe";
    }
  }

  /**
   * {@code {"op":"ping","ts":<int>}}; {@code ts} may be omitted.
   */
  record Ping(Long ts) implements ClientCommand {
    @Override
    public String op() {
      return "ping";
    }
  }
}
