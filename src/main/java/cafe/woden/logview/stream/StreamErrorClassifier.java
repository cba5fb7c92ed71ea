package cafe.woden.logview.stream;

import io.reactivex.rxjava3.exceptions.CompositeException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a live stream failure is worth retrying.
 *
 * <p>Fatal: cancellation, HTTP 4xx, anything unrecognized. Transient: network I/O failures,
 * timeouts, HTTP 5xx, and failures whose message names a connection reset or protocol error.
 */
public final class StreamErrorClassifier {

  private static final List<String> TRANSIENT_KEYWORDS =
      List.of(
          "econnreset",
          "connection reset",
          "reset by peer",
          "goaway",
          "protocol error",
          "protocol_error",
          "network",
          "broken pipe",
          "connection closed",
          "stream was reset",
          "timed out");

  private static final int MAX_CAUSE_DEPTH = 8;

  private StreamErrorClassifier() {}

  public static boolean isTransient(Throwable error) {
    return classify(error) == Kind.TRANSIENT;
  }

  public enum Kind {
    TRANSIENT,
    FATAL
  }

  public static Kind classify(Throwable error) {
    if (error == null) return Kind.FATAL;
    if (error instanceof CompositeException ce && !ce.getExceptions().isEmpty()) {
      return classify(ce.getExceptions().get(0));
    }

    Throwable t = error;
    for (int depth = 0; t != null && depth < MAX_CAUSE_DEPTH; depth++, t = t.getCause()) {
      if (t instanceof CancellationException || t instanceof InterruptedException) {
        return Kind.FATAL;
      }
      if (t instanceof StreamHttpException http) {
        if (http.isServerError()) return Kind.TRANSIENT;
        if (http.isClientError()) return Kind.FATAL;
      }
    }

    t = error;
    for (int depth = 0; t != null && depth < MAX_CAUSE_DEPTH; depth++, t = t.getCause()) {
      if (t instanceof StreamHttpException) continue;
      if (t instanceof InterruptedIOException || t instanceof TimeoutException) {
        return Kind.TRANSIENT;
      }
      if (t instanceof IOException) return Kind.TRANSIENT;
      if (matchesKeyword(t.getMessage())) return Kind.TRANSIENT;
    }
    return Kind.FATAL;
  }

  static boolean matchesKeyword(String message) {
    if (message == null || message.isBlank()) return false;
    String m = message.toLowerCase(Locale.ROOT);
    for (String k : TRANSIENT_KEYWORDS) {
      if (m.contains(k)) return true;
    }
    return false;
  }
}
