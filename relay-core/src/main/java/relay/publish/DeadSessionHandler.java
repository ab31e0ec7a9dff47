package relay.publish;

import relay.registry.Session;

/**
 * Called by {@link FanoutPublisher} when writing a frame to a session fails. The handler
 * must make sure the session is deregistered; the publisher keeps delivering to the others.
 */
@FunctionalInterface
public interface DeadSessionHandler {

  void onWriteFailure(Session session, Exception failure);
}
