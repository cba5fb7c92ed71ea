package cafe.woden.logview.stream;

public enum StreamPhase {
  IDLE,
  CONNECTING,
  STREAMING,
  /** Waiting out a backoff delay after a transient failure. */
  RECONNECTING,
  /** Connected, but entries are held back until resume. */
  PAUSED,
  /** The source finished normally. */
  COMPLETE,
  /** Fatal failure or retries exhausted; only {@code restart()} leaves this state. */
  ERROR
}
