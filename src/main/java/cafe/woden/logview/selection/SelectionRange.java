package cafe.woden.logview.selection;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Contiguous entry selection with anchor/focus semantics.
 *
 * @param epoch entry store generation the indices refer to
 */
@ValueObject
public record SelectionRange(int anchorIndex, int focusIndex, long epoch) {

  public SelectionRange {
    if (anchorIndex < 0) throw new IllegalArgumentException("anchorIndex must be >= 0");
    if (focusIndex < 0) throw new IllegalArgumentException("focusIndex must be >= 0");
  }

  public int min() {
    return Math.min(anchorIndex, focusIndex);
  }

  /** Inclusive. */
  public int max() {
    return Math.max(anchorIndex, focusIndex);
  }

  public int length() {
    return max() - min() + 1;
  }

  public boolean contains(int entryIndex) {
    return entryIndex >= min() && entryIndex <= max();
  }
}
