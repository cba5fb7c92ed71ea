package cafe.woden.logview.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogIoType;
import cafe.woden.logview.model.LogLabels;
import cafe.woden.logview.model.LogLevel;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogFacetsTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void countsMostFrequentFirstThenByValue() {
    List<LogEntry> entries =
        List.of(
            entry("1", LogLevel.INFO, "train", LogIoType.STDOUT),
            entry("2", LogLevel.INFO, "prep", LogIoType.OSMO_CTRL),
            entry("3", LogLevel.ERROR, "train", LogIoType.STDERR),
            entry("4", LogLevel.INFO, "eval", LogIoType.STDOUT));

    List<FieldFacet> facets = LogFacets.compute(entries, LogFacets.DEFAULT_FIELDS);

    assertEquals(
        List.of("level", "source", "task", "retry"),
        facets.stream().map(FieldFacet::field).toList());
    assertEquals(
        List.of(new FacetValue("info", 3), new FacetValue("error", 1)), facets.get(0).values());
    assertEquals(
        List.of(new FacetValue("user", 3), new FacetValue("osmo", 1)), facets.get(1).values());
    assertEquals(
        List.of(new FacetValue("train", 2), new FacetValue("eval", 1), new FacetValue("prep", 1)),
        facets.get(2).values());
  }

  @Test
  void missingValuesAreNotCounted() {
    List<LogEntry> entries = List.of(new LogEntry("1", T0, LogLevel.INFO, "no labels"));

    List<FieldFacet> facets = LogFacets.compute(entries, List.of("task", " "));

    assertEquals(1, facets.size());
    assertTrue(facets.get(0).values().isEmpty());
  }

  private static LogEntry entry(String id, LogLevel level, String task, LogIoType io) {
    return new LogEntry(id, T0, level, "m", new LogLabels(task, "0", io));
  }
}
