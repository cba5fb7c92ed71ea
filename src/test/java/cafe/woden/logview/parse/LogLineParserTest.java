package cafe.woden.logview.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import cafe.woden.logview.model.LogEntry;
import cafe.woden.logview.model.LogIoType;
import cafe.woden.logview.model.LogLevel;
import cafe.woden.logview.model.LogSourceType;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogLineParserTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final LogLineParser parser = new LogLineParser(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void parsesTimestampTaskAndMessage() {
    LogEntry e = parser.parseLine("2024/05/01 10:15:30 [train] epoch 1 done");

    assertEquals(Instant.parse("2024-05-01T10:15:30Z"), e.timestamp());
    assertEquals("train", e.labels().task());
    assertEquals("0", e.labels().retry());
    assertEquals(LogIoType.STDOUT, e.labels().ioType());
    assertEquals("epoch 1 done", e.message());
  }

  @Test
  void parsesRetryAndPlatformMarker() {
    LogEntry e = parser.parseLine("2024/05/01 10:15:30 [train retry-2][osmo] Downloading data");

    assertEquals("2", e.labels().retry());
    assertEquals(LogIoType.OSMO_CTRL, e.labels().ioType());
    assertEquals(LogSourceType.OSMO, e.labels().source());
    assertEquals("Downloading data", e.message());
  }

  @Test
  void unrecognizedLinesBecomeDumpLinesAtNow() {
    LogEntry e = parser.parseLine("\u001B[31mTraceback (most recent call last):\u001B[0m");

    assertEquals(NOW, e.timestamp());
    assertEquals(LogIoType.DUMP, e.labels().ioType());
    assertEquals("Traceback (most recent call last):", e.message());
  }

  @Test
  void invalidDateFallsBackToDump() {
    LogEntry e = parser.parseLine("2024/13/45 10:15:30 [train] nope");

    assertEquals(LogIoType.DUMP, e.labels().ioType());
  }

  @Test
  void jsonLinesCarryLevelLabelsAndId() {
    LogEntry e =
        parser.parseLine(
            "{\"id\":\"x1\",\"timestamp\":\"2024-05-01T10:00:00Z\",\"level\":\"warning\","
                + "\"message\":\"disk low\",\"labels\":{\"task\":\"prep\",\"io_type\":\"stderr\","
                + "\"node\":\"n7\"}}");

    assertEquals("x1", e.id());
    assertEquals(LogLevel.WARN, e.level());
    assertEquals("prep", e.labels().task());
    assertEquals(LogIoType.STDERR, e.labels().ioType());
    assertEquals("n7", e.labels().get("node"));
    assertEquals("disk low", e.message());
  }

  @Test
  void jsonWithoutTimestampIsKeptAsDump() {
    LogEntry e = parser.parseLine("{\"message\":\"no time\"}");

    assertEquals(LogIoType.DUMP, e.labels().ioType());
    assertEquals("{\"message\":\"no time\"}", e.message());
  }

  @Test
  void blankLinesAreSkipped() {
    assertNull(parser.parseLine("   "));

    List<LogEntry> batch =
        parser.parseBatch("2024/05/01 10:00:00 [a] one\r\n\n2024/05/01 10:00:01 [a] two\n");

    assertEquals(2, batch.size());
    assertNotEquals(batch.get(0).id(), batch.get(1).id());
  }
}
