package cafe.woden.logview.query;

/** Match mode used by the message text filter. */
public enum LogSearchMode {
  CONTAINS,
  GLOB,
  REGEX
}
