package relay.protocol;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-window command counter for one connection.
 *
 * <p>The window starts at the first command and resets once {@code window} has elapsed.
 * Commands beyond {@code maxCommands} inside the window are refused, not queued.
 */
public final class CommandRateLimiter {
  private final int maxCommands;
  private final long windowMs;
  private final Clock clock;

  private long windowStartMs = Long.MIN_VALUE;
  private int count;

  public CommandRateLimiter(int maxCommands, Duration window, Clock clock) {
    if (maxCommands <= 0) {
      throw new IllegalArgumentException("maxCommands must be > 0, got: " + maxCommands);
    }
    Objects.requireNonNull(window, "window");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    this.maxCommands = maxCommands;
    this.windowMs = window.toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Counts one command.
   *
   * @return {@code true} if the command is within the limit
   */
  public synchronized boolean tryAcquire() {
    long now = clock.millis();
    if (windowStartMs == Long.MIN_VALUE || now - windowStartMs >= windowMs) {
      windowStartMs = now;
      count = 0;
    }
    if (count >= maxCommands) {
      return false;
    }
    count++;
    return true;
  }
}
