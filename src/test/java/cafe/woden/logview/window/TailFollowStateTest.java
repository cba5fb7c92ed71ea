package cafe.woden.logview.window;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TailFollowStateTest {

  @Test
  void scrollingAwayStopsTailingOnce() {
    TailFollowState tail = new TailFollowState(50, true);

    assertTrue(tail.onScroll(400, 1_000, 500));
    assertFalse(tail.isTailing());
    assertFalse(tail.onScroll(100, 1_000, 500));
  }

  @Test
  void nearBottomKeepsTailing() {
    TailFollowState tail = new TailFollowState(50, true);

    assertFalse(tail.onScroll(460, 1_000, 500));
    assertTrue(tail.isTailing());
    assertTrue(tail.shouldAutoScroll(10));
    assertFalse(tail.shouldAutoScroll(0));
  }

  @Test
  void onlyExplicitResumeRestartsTailing() {
    TailFollowState tail = new TailFollowState(50, true);
    tail.onScroll(0, 1_000, 500);

    tail.onScroll(500, 1_000, 500);
    assertFalse(tail.isTailing());

    tail.resume();
    assertTrue(tail.isTailing());
    tail.stop();
    assertFalse(tail.shouldAutoScroll(5));
  }

  @Test
  void rejectsNonPositiveThreshold() {
    assertThrows(IllegalArgumentException.class, () -> new TailFollowState(0, true));
  }
}
