package io.estatekeeper.backend.activity;

import java.util.List;

/**
 * One page of raw events, newest first.
 *
 * @param events at most {@code limit} events
 * @param nextCursor position of the last event when older events exist; null on the final page
 */
public record ActivityPage(List<ActivityEvent> events, ActivityCursor nextCursor) {

  public static ActivityPage empty() {
    return new ActivityPage(List.of(), null);
  }

  public boolean hasNext() {
    return nextCursor != null;
  }
}
