package relay.protocol;

/**
 * Codes carried in the {@code error.code} field of an error frame. The constant name is
 * the wire value.
 */
public enum ErrorCode {
  UNAUTHORIZED,
  TOKEN_EXPIRED,
  FORBIDDEN_CONVERSATION,
  INVALID_COMMAND,
  RATE_LIMITED,
  INTERNAL_ERROR
}
