package cafe.woden.logview.stream;

import cafe.woden.logview.model.LogEntry;
import java.util.Objects;

/** Signals delivered by one live connection. */
public sealed interface LiveEvent permits LiveEvent.Connected, LiveEvent.Received {

  static LiveEvent connected() {
    return Connected.INSTANCE;
  }

  static LiveEvent of(LogEntry entry) {
    return new Received(entry);
  }

  /** The transport accepted the request; entries may follow at any later time. */
  record Connected() implements LiveEvent {
    static final Connected INSTANCE = new Connected();
  }

  record Received(LogEntry entry) implements LiveEvent {
    public Received {
      Objects.requireNonNull(entry, "entry");
    }
  }
}
