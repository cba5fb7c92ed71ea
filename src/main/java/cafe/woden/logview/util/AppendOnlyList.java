package cafe.woden.logview.util;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Immutable, fixed-size view over a shared append-only buffer.
 *
 * <p>Appending to the newest view of a buffer extends the buffer in place (O(k) for k new
 * elements) and returns a longer view; older views keep their own size and never observe the new
 * elements. Appending to a view that is no longer the newest one copies its prefix into a fresh
 * buffer first, so branching never corrupts another view.
 */
public final class AppendOnlyList<E> extends AbstractList<E> implements RandomAccess {

  private static final AppendOnlyList<?> EMPTY = new AppendOnlyList<>(new ArrayList<>(0), 0);

  private final ArrayList<E> buffer;
  private final int size;

  private AppendOnlyList(ArrayList<E> buffer, int size) {
    this.buffer = buffer;
    this.size = size;
  }

  @SuppressWarnings("unchecked")
  public static <E> AppendOnlyList<E> empty() {
    return (AppendOnlyList<E>) EMPTY;
  }

  public static <E> AppendOnlyList<E> copyOf(Collection<? extends E> source) {
    if (source == null || source.isEmpty()) return empty();
    ArrayList<E> buf = new ArrayList<>(Math.max(16, source.size() + (source.size() >> 1)));
    for (E e : source) {
      buf.add(Objects.requireNonNull(e, "element"));
    }
    return new AppendOnlyList<>(buf, buf.size());
  }

  /** Returns a view extended by {@code more}; this view is left unchanged. */
  public AppendOnlyList<E> appendAll(List<? extends E> more) {
    if (more == null || more.isEmpty()) return this;
    if (this == EMPTY) return copyOf(more);
    synchronized (buffer) {
      if (buffer.size() == size) {
        for (E e : more) {
          buffer.add(Objects.requireNonNull(e, "element"));
        }
        return new AppendOnlyList<>(buffer, buffer.size());
      }
      ArrayList<E> fork = new ArrayList<>(size + more.size() + 16);
      fork.addAll(buffer.subList(0, size));
      for (E e : more) {
        fork.add(Objects.requireNonNull(e, "element"));
      }
      return new AppendOnlyList<>(fork, fork.size());
    }
  }

  @Override
  public E get(int index) {
    Objects.checkIndex(index, size);
    synchronized (buffer) {
      return buffer.get(index);
    }
  }

  @Override
  public int size() {
    return size;
  }
}
