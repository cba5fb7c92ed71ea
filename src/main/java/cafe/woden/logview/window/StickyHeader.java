package cafe.woden.logview.window;

import cafe.woden.logview.flatten.FlatItem;

/**
 * Floating date header state for a scroll position.
 *
 * @param current separator whose group contains the top of the viewport
 * @param visible whether the viewport has scrolled past the first separator
 * @param pushOffset negative pixel offset while the next separator pushes the header out, else 0
 */
public record StickyHeader(FlatItem.SeparatorItem current, boolean visible, long pushOffset) {

  public static final StickyHeader NONE = new StickyHeader(null, false, 0);

  public boolean pushing() {
    return pushOffset < 0;
  }
}
