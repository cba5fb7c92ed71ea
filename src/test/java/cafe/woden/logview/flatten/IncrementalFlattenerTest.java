package cafe.woden.logview.flatten;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogLevel;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class IncrementalFlattenerTest {

  private static final Instant DAY1 = Instant.parse("2024-05-01T23:58:00Z");

  @Test
  void firstEntryGetsSeparatorAndEachNewDayAnother() {
    List<LogEntry> entries =
        List.of(entry(0, DAY1), entry(1, DAY1.plusSeconds(60)), entry(2, DAY1.plusSeconds(180)));

    FlatList flat = IncrementalFlattener.rebuild(entries, 1);

    assertEquals(5, flat.size());
    FlatItem.SeparatorItem first = assertInstanceOf(FlatItem.SeparatorItem.class, flat.get(0));
    assertEquals(LocalDate.of(2024, 5, 1), first.date());
    assertEquals(0, first.precedingEntryIndex());
    FlatItem.SeparatorItem second = assertInstanceOf(FlatItem.SeparatorItem.class, flat.get(3));
    assertEquals(LocalDate.of(2024, 5, 2), second.date());
    assertEquals(2, second.precedingEntryIndex());
    assertEquals(2, flat.separators().size());
    assertTrue(flat.rebuilt());
  }

  @Test
  void sameDayAppendAddsNoSeparator() {
    List<LogEntry> entries = new ArrayList<>(List.of(entry(0, DAY1)));
    FlatList prior = IncrementalFlattener.flatten(entries, 1, null);

    entries.add(entry(1, DAY1.plusSeconds(30)));
    FlatList next = IncrementalFlattener.flatten(entries, 1, prior);

    assertFalse(next.rebuilt());
    assertEquals(3, next.size());
    assertEquals(1, next.separators().size());
    FlatItem.EntryItem tail = assertInstanceOf(FlatItem.EntryItem.class, next.get(2));
    assertEquals(1, tail.entryIndex());
    assertEquals(2, tail.flatIndex());
  }

  @Test
  void incrementalMatchesFullRebuild() {
    Random random = new Random(0x10AD5L);
    List<LogEntry> entries = new ArrayList<>();
    Instant ts = DAY1.minusSeconds(86_400 * 2);
    FlatList flat = FlatList.EMPTY;
    for (int round = 0; round < 50; round++) {
      int k = random.nextInt(6);
      for (int i = 0; i < k; i++) {
        ts = ts.plusSeconds(random.nextInt(20_000));
        entries.add(entry(entries.size(), ts));
      }
      flat = IncrementalFlattener.flatten(List.copyOf(entries), 7, flat);
      FlatList full = IncrementalFlattener.rebuild(List.copyOf(entries), 7);
      assertEquals(full.items(), flat.items());
      assertEquals(full.separators(), flat.separators());
      assertEquals(full.lastDateKey(), flat.lastDateKey());
    }
  }

  @Test
  void generationChangeForcesRebuild() {
    List<LogEntry> entries = List.of(entry(0, DAY1), entry(1, DAY1.plusSeconds(1)));
    FlatList prior = IncrementalFlattener.flatten(entries, 1, null);

    FlatList next = IncrementalFlattener.flatten(entries.subList(0, 1), 2, prior);

    assertTrue(next.rebuilt());
    assertEquals(2, next.size());
    assertEquals(2, next.generation());
  }

  @Test
  void unchangedEntriesReuseItemsWithoutRebuildFlag() {
    List<LogEntry> entries = List.of(entry(0, DAY1));
    FlatList prior = IncrementalFlattener.flatten(entries, 1, null);

    FlatList again = IncrementalFlattener.flatten(entries, 1, prior);

    assertFalse(again.rebuilt());
    assertSame(prior.items(), again.items());
  }

  @Test
  void emptyEntriesProduceEmptyList() {
    FlatList flat = IncrementalFlattener.flatten(List.of(), 3, null);

    assertTrue(flat.isEmpty());
    assertEquals(0, flat.entryCount());
  }

  private static LogEntry entry(int n, Instant ts) {
    return new LogEntry("id-" + n, ts, LogLevel.INFO, "m" + n);
  }
}
