package cafe.woden.logview.stream;

import java.io.IOException;

/** Non-success HTTP status from the log stream endpoint. */
public class StreamHttpException extends IOException {

  private final int status;

  public StreamHttpException(int status, String message) {
    super("Stream failed: " + status + (message == null || message.isBlank() ? "" : " " + message));
    this.status = status;
  }

  public int status() {
    return status;
  }

  public boolean isServerError() {
    return status >= 500 && status <= 599;
  }

  public boolean isClientError() {
    return status >= 400 && status <= 499;
  }
}
