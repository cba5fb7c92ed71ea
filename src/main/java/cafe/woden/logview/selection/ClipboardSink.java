package cafe.woden.logview.selection;

/** Destination for copied selection text. */
@FunctionalInterface
public interface ClipboardSink {
  void copy(String text);
}
