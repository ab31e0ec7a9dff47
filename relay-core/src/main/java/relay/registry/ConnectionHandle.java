package relay.registry;

import java.io.IOException;

/**
 * Transport-side view of one client connection.
 *
 * <p>{@link #send} may be called from the dispatcher thread and from transport threads
 * concurrently; implementations serialize writes themselves.
 */
public interface ConnectionHandle {

  /**
   * Writes one text frame.
   *
   * @throws IOException if the frame could not be written; the connection is then
   *                     considered dead
   */
  void send(String text) throws IOException;

  /**
   * Closes the underlying connection. Closing an already closed connection is a no-op.
   */
  void close(CloseReason reason);

  boolean isOpen();
}
