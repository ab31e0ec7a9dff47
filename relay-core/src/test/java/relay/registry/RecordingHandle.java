package relay.registry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * ConnectionHandle that records sent frames and close calls, optionally failing writes.
 */
public class RecordingHandle implements ConnectionHandle {
  private final List<String> frames = new ArrayList<>();
  private final List<CloseReason> closes = new ArrayList<>();
  private volatile boolean failWrites;

  public RecordingHandle() {
  }

  public RecordingHandle failingWrites() {
    this.failWrites = true;
    return this;
  }

  @Override
  public synchronized void send(String text) throws IOException {
    if (failWrites) {
      throw new IOException("broken pipe");
    }
    frames.add(text);
  }

  @Override
  public synchronized void close(CloseReason reason) {
    closes.add(reason);
  }

  @Override
  public synchronized boolean isOpen() {
    return closes.isEmpty();
  }

  public synchronized List<String> frames() {
    return new ArrayList<>(frames);
  }

  public synchronized String lastFrame() {
    return frames.isEmpty() ? null : frames.get(frames.size() - 1);
  }

  public synchronized List<CloseReason> closes() {
    return new ArrayList<>(closes);
  }

  public synchronized void clear() {
    frames.clear();
  }
}
