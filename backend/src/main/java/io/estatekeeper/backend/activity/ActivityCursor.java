package io.estatekeeper.backend.activity;

import java.time.Instant;
import java.util.Objects;

/**
 * Pagination position: the {@code (createdAt, id)} of the last event a client has seen. The next
 * page holds only events strictly older than this position.
 */
public record ActivityCursor(Instant at, long id) {

  public ActivityCursor {
    Objects.requireNonNull(at, "at");
    if (id <= 0) {
      throw new IllegalArgumentException("cursor id must be positive: " + id);
    }
  }
}
