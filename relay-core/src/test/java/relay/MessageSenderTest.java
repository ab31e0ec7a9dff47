package relay;

import relay.model.OutboxEvent;
import relay.sequence.MessageSequencer;
import relay.util.JsonCodec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageSenderTest {
  private StubTxContext txContext;
  private InMemoryOutboxStore outboxStore;
  private MessageSender sender;

  @BeforeEach
  void setUp() {
    txContext = new StubTxContext(true);
    outboxStore = new InMemoryOutboxStore();
    OutboxWriter writer = new OutboxWriter(txContext, outboxStore, null, JsonCodec.getDefault(), Clock.systemUTC());
    sender = new MessageSender(txContext, new MessageSequencer(new InMemoryMessageStore()), writer, 500);
  }

  @Test
  void newMessageAppendsCreatedAndUpdatedEvents() {
    SendResult result = sender.send(new SendMessageRequest("c1", "alice", "m1", "hi"));

    assertTrue(result.created());
    List<OutboxEvent> rows = outboxStore.all();
    assertEquals(2, rows.size());
    assertEquals("message.created", rows.get(0).eventType());
    assertEquals("conversation.updated", rows.get(1).eventType());

    Map<String, Object> created = JsonCodec.getDefault().parseObject(rows.get(0).payloadJson());
    assertEquals(1, ((Number) created.get("seq")).intValue());
    @SuppressWarnings("unchecked")
    Map<String, Object> payload = (Map<String, Object>) created.get("payload");
    assertEquals(result.message().id(), payload.get("id"));
    assertEquals("alice", payload.get("sender_id"));
    assertEquals("m1", payload.get("client_message_id"));
    assertEquals("hi", payload.get("content"));

    Map<String, Object> updated = JsonCodec.getDefault().parseObject(rows.get(1).payloadJson());
    @SuppressWarnings("unchecked")
    Map<String, Object> conversation = (Map<String, Object>) updated.get("payload");
    assertEquals("c1", conversation.get("id"));
    assertEquals("hi", conversation.get("last_message_preview"));
  }

  @Test
  void replayAppendsNothing() {
    SendResult first = sender.send(new SendMessageRequest("c1", "alice", "m1", "hi"));
    SendResult second = sender.send(new SendMessageRequest("c1", "alice", "m1", "hi"));

    assertFalse(second.created());
    assertEquals(first.message().id(), second.message().id());
    assertEquals(2, outboxStore.all().size());
  }

  @Test
  void previewIsTruncated() {
    String content = "x".repeat(400);
    sender.send(new SendMessageRequest("c1", "alice", "m1", content));

    Map<String, Object> updated = JsonCodec.getDefault().parseObject(outboxStore.all().get(1).payloadJson());
    @SuppressWarnings("unchecked")
    Map<String, Object> conversation = (Map<String, Object>) updated.get("payload");
    assertEquals(280, ((String) conversation.get("last_message_preview")).length());
  }

  @Test
  void rejectsBlankOrOversizedContent() {
    assertThrows(IllegalArgumentException.class, () ->
        sender.send(new SendMessageRequest("c1", "alice", "m1", "  ")));
    assertThrows(IllegalArgumentException.class, () ->
        sender.send(new SendMessageRequest("c1", "alice", "m2", "x".repeat(501))));
    assertTrue(outboxStore.all().isEmpty());
  }

  @Test
  void requiresActiveTransaction() {
    StubTxContext inactive = new StubTxContext(false);
    MessageSender outside = new MessageSender(inactive, new MessageSequencer(new InMemoryMessageStore()),
        new OutboxWriter(inactive, outboxStore));

    assertThrows(IllegalStateException.class, () ->
        outside.send(new SendMessageRequest("c1", "alice", "m1", "hi")));
  }
}
