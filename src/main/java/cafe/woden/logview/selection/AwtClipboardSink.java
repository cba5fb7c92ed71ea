package cafe.woden.logview.selection;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Copies to the system clipboard; a no-op in headless JVMs. */
public final class AwtClipboardSink implements ClipboardSink {
  private static final Logger log = LoggerFactory.getLogger(AwtClipboardSink.class);

  @Override
  public void copy(String text) {
    if (text == null || text.isEmpty()) return;
    if (GraphicsEnvironment.isHeadless()) {
      log.debug("[logview] headless JVM; skipping clipboard copy of {} chars", text.length());
      return;
    }
    try {
      Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(text), null);
    } catch (IllegalStateException e) {
      // Clipboard is briefly owned by another application.
      log.warn("[logview] system clipboard unavailable: {}", e.toString());
    }
  }
}
