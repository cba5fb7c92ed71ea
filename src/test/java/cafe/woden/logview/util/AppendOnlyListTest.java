package cafe.woden.logview.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AppendOnlyListTest {

  @Test
  void appendKeepsOlderViewsAtTheirOwnSize() {
    AppendOnlyList<String> a = AppendOnlyList.copyOf(List.of("a", "b"));
    AppendOnlyList<String> b = a.appendAll(List.of("c"));

    assertEquals(List.of("a", "b"), a);
    assertEquals(List.of("a", "b", "c"), b);
    assertThrows(IndexOutOfBoundsException.class, () -> a.get(2));
  }

  @Test
  void appendingToAnOlderViewForks() {
    AppendOnlyList<String> base = AppendOnlyList.copyOf(List.of("a"));
    AppendOnlyList<String> left = base.appendAll(List.of("b"));
    AppendOnlyList<String> right = base.appendAll(List.of("x", "y"));

    assertEquals(List.of("a", "b"), left);
    assertEquals(List.of("a", "x", "y"), right);
    assertEquals(List.of("a"), base);
  }

  @Test
  void emptyAppendsReturnSameView() {
    AppendOnlyList<String> a = AppendOnlyList.copyOf(List.of("a"));
    assertSame(a, a.appendAll(List.of()));
    assertSame(a, a.appendAll(null));
    assertTrue(AppendOnlyList.copyOf(List.of()).isEmpty());
    assertEquals(List.of("z"), AppendOnlyList.<String>empty().appendAll(List.of("z")));
    assertTrue(AppendOnlyList.empty().isEmpty());
  }

  @Test
  void viewsAreUnmodifiable() {
    AppendOnlyList<String> a = AppendOnlyList.copyOf(List.of("a"));
    assertThrows(UnsupportedOperationException.class, () -> a.add("b"));
  }
}
