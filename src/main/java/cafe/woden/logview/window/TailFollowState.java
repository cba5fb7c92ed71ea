package cafe.woden.logview.window;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks whether the view should keep following new lines at the bottom.
 *
 * <p>Scrolling farther than the threshold away from the bottom stops following; only an explicit
 * {@link #resume()} starts it again.
 */
public final class TailFollowState {
  private static final Logger log = LoggerFactory.getLogger(TailFollowState.class);

  private final int bottomThreshold;
  private volatile boolean tailing;

  public TailFollowState(int bottomThreshold, boolean tailing) {
    if (bottomThreshold <= 0) throw new IllegalArgumentException("bottomThreshold must be > 0");
    this.bottomThreshold = bottomThreshold;
    this.tailing = tailing;
  }

  public boolean isTailing() {
    return tailing;
  }

  /** Returns {@code true} when this scroll report stopped tailing. */
  public boolean onScroll(long scrollTop, long scrollHeight, long clientHeight) {
    boolean atBottom = scrollHeight - scrollTop - clientHeight < bottomThreshold;
    if (!atBottom && tailing) {
      tailing = false;
      log.debug("[logview] scrolled away from bottom; tail follow off");
      return true;
    }
    return false;
  }

  public void resume() {
    tailing = true;
  }

  public void stop() {
    tailing = false;
  }

  /** Whether the host should jump to the bottom after {@code itemCount} changed. */
  public boolean shouldAutoScroll(int itemCount) {
    return tailing && itemCount > 0;
  }
}
