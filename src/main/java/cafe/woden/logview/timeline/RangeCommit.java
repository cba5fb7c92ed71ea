package cafe.woden.logview.timeline;

import java.time.Instant;

/**
 * Published whenever an effective range is committed; consumers refetch the batch.
 *
 * @param sequence increments with every commit of one state machine
 */
public record RangeCommit(Instant effectiveStart, Instant effectiveEnd, long sequence) {}
