package cafe.woden.logview.timeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class RangeValidatorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:10:00Z");
  private static final long MIN = 60_000;
  private static final long TOLERANCE = 60_000;

  @Test
  void missingBoundsAreAlwaysValid() {
    assertTrue(RangeValidator.isValidRange(null, null, NOW, MIN, TOLERANCE));
    assertTrue(RangeValidator.isValidRange(NOW.plusSeconds(3_600), null, NOW, MIN, TOLERANCE));
    assertTrue(RangeValidator.isValidRange(null, NOW.minusSeconds(3_600), NOW, MIN, TOLERANCE));
  }

  @Test
  void boundedRangeNeedsOrderMinimumAndNoFuture() {
    Instant start = NOW.minusSeconds(600);
    assertTrue(RangeValidator.isValidRange(start, start.plusSeconds(60), NOW, MIN, TOLERANCE));
    assertFalse(RangeValidator.isValidRange(start, start.plusSeconds(59), NOW, MIN, TOLERANCE));
    assertFalse(RangeValidator.isValidRange(start, start, NOW, MIN, TOLERANCE));
    assertFalse(RangeValidator.isValidRange(NOW, start, NOW, MIN, TOLERANCE));
    assertTrue(RangeValidator.isValidRange(start, NOW.plusSeconds(60), NOW, MIN, TOLERANCE));
    assertFalse(RangeValidator.isValidRange(start, NOW.plusSeconds(61), NOW, MIN, TOLERANCE));
  }

  @Test
  void paddingHasAFloor() {
    assertEquals(30_000, DisplayPadding.paddingMs(60_000, 0.075, 30_000));
    assertEquals(270_000, DisplayPadding.paddingMs(3_600_000, 0.075, 30_000));
    assertEquals(30_000, DisplayPadding.paddingMs(0, 0.075, 30_000));
  }

  @Test
  void paddingAroundLoneBoundUsesFallback() {
    DisplayRange d =
        DisplayPadding.around(
            null, NOW, NOW.minusSeconds(3_600), NOW.plusSeconds(1), 0.075, 30_000);

    assertEquals(NOW.minusSeconds(3_600 + 270), d.start());
    assertEquals(NOW.plusSeconds(270), d.end());
  }
}
