package cafe.woden.logview.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import cafe.woden.logview.config.LogViewProperties;
import cafe.woden.logview.flatten.FlatList;
import cafe.woden.logview.flatten.IncrementalFlattener;
import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogLevel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToLongFunction;
import org.junit.jupiter.api.Test;

class WindowedViewProviderTest {

  private static final Instant LATE = Instant.parse("2024-05-01T23:59:00Z");
  private static final LogViewProperties.Rows ROWS = new LogViewProperties.Rows(24, 120, 32, 50);

  private final WindowedViewHost host = mock(WindowedViewHost.class);
  private final WindowedViewProvider provider = new WindowedViewProvider(host, ROWS);

  @Test
  void rebuildInvalidatesButAppendOnlyReportsCount() {
    List<LogEntry> entries = new ArrayList<>(List.of(entry("a", LATE)));
    FlatList first = IncrementalFlattener.flatten(List.copyOf(entries), 1, null);
    provider.update(first, List.copyOf(entries));
    verify(host).invalidateMeasurements();
    verify(host).itemCountChanged(2);

    entries.add(entry("b", LATE.plusSeconds(10)));
    FlatList appended = IncrementalFlattener.flatten(List.copyOf(entries), 1, first);
    provider.update(appended, List.copyOf(entries));

    verify(host, times(1)).invalidateMeasurements();
    verify(host).itemCountChanged(3);
  }

  @Test
  void sameFlatListIsIgnored() {
    FlatList flat = IncrementalFlattener.flatten(List.of(entry("a", LATE)), 1, null);
    provider.update(flat, List.of());
    provider.update(flat, List.of());

    verify(host, times(1)).invalidateMeasurements();
  }

  @Test
  void estimateSizeDependsOnItemKindAndExpansion() {
    List<LogEntry> entries = List.of(entry("a", LATE), entry("b", LATE.plusSeconds(5)));
    provider.update(IncrementalFlattener.flatten(entries, 1, null), entries);

    assertEquals(32, provider.estimateSize(0));
    assertEquals(24, provider.estimateSize(1));
    assertEquals(24, provider.estimateSize(99));

    assertTrue(provider.toggleExpanded("b"));
    assertEquals(120, provider.estimateSize(2));
    assertEquals(24, provider.estimateSize(1));

    assertFalse(provider.toggleExpanded("b"));
    assertEquals(24, provider.estimateSize(2));
    verify(host, times(3)).invalidateMeasurements();
  }

  @Test
  void collapseAllOnlyInvalidatesWhenSomethingWasExpanded() {
    provider.collapseAll();
    verifyNoInteractions(host);

    provider.toggleExpanded("x");
    provider.collapseAll();

    assertFalse(provider.isExpanded("x"));
    verify(host, times(2)).invalidateMeasurements();
  }

  @Test
  void separatorLookupsUseFlatPositions() {
    provider.update(twoDays(), List.of());

    assertEquals(0, provider.separatorAtOrBefore(2).orElseThrow().flatIndex());
    assertEquals(3, provider.separatorAtOrBefore(3).orElseThrow().flatIndex());
    assertEquals(3, provider.nextSeparatorAfter(0).orElseThrow().flatIndex());
    assertTrue(provider.nextSeparatorAfter(3).isEmpty());
    assertTrue(provider.separatorAtOrBefore(-1).isEmpty());
  }

  @Test
  void stickyHeaderFollowsScrollAndIsPushedByNextSeparator() {
    provider.update(twoDays(), List.of());
    IntToLongFunction offsets = this::offsetOf;

    StickyHeader top = provider.stickyHeader(0, offsets);
    assertEquals(0, top.current().flatIndex());
    assertFalse(top.visible());

    StickyHeader scrolled = provider.stickyHeader(10, offsets);
    assertTrue(scrolled.visible());
    assertFalse(scrolled.pushing());

    // second separator sits at 80px, 20px below the viewport top
    StickyHeader pushed = provider.stickyHeader(60, offsets);
    assertEquals(0, pushed.current().flatIndex());
    assertEquals(-12, pushed.pushOffset());

    StickyHeader nextDay = provider.stickyHeader(90, offsets);
    assertEquals(3, nextDay.current().flatIndex());
    assertEquals(0, nextDay.pushOffset());
  }

  @Test
  void stickyHeaderIsNoneWithoutSeparators() {
    StickyHeader header = provider.stickyHeader(100, i -> i * 24L);

    assertNull(header.current());
    verify(host, never()).invalidateMeasurements();
  }

  private long offsetOf(int flatIndex) {
    long offset = 0;
    for (int i = 0; i < flatIndex; i++) {
      offset += provider.estimateSize(i);
    }
    return offset;
  }

  // [sep, a, b, sep, c]
  private static FlatList twoDays() {
    return IncrementalFlattener.flatten(
        List.of(
            entry("a", LATE), entry("b", LATE.plusSeconds(30)), entry("c", LATE.plusSeconds(120))),
        1,
        null);
  }

  private static LogEntry entry(String id, Instant ts) {
    return new LogEntry(id, ts, LogLevel.INFO, id);
  }
}
