package relay.protocol;

/**
 * Converts between wire text and the typed frame variants.
 *
 * @see JacksonFrameCodec
 */
public interface FrameCodec {

  /**
   * Decodes one inbound text frame. Size limits are enforced by the caller.
   *
   * @throws ProtocolException with {@link ErrorCode#INVALID_COMMAND} if the text is not a
   *                           well-formed command
   */
  ClientCommand decode(String text) throws ProtocolException;

  /**
   * Encodes one outbound frame as JSON text.
   */
  String encode(ServerFrame frame);
}
