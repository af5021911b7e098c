package io.estatekeeper.backend.testutil;

import io.estatekeeper.backend.activity.ActivityEvent;
import io.estatekeeper.backend.activity.ActivityEventRecord;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Builds {@link ActivityEvent}s with a fixed id, as if they had been read back from the store. */
public final class TestActivityEventFactory {

  public static ActivityEvent event(long id, UUID estateId, Instant createdAt) {
    return event(id, estateId, createdAt, "TASK", "created", "Event " + id, null, null);
  }

  public static ActivityEvent event(
      long id,
      UUID estateId,
      Instant createdAt,
      String category,
      String action,
      String message,
      String subjectId,
      String subjectType) {
    return withFields(
        id, estateId, createdAt, category, action, message, subjectId, subjectType, null, null);
  }

  public static ActivityEvent withFields(
      long id,
      UUID estateId,
      Instant createdAt,
      String category,
      String action,
      String message,
      String subjectId,
      String subjectType,
      String href,
      String sublabel) {
    var record =
        new ActivityEventRecord(
            estateId.toString(),
            category,
            action,
            message,
            subjectId,
            subjectType,
            href,
            sublabel,
            null,
            Map.of());
    return withId(new ActivityEvent(estateId, record, createdAt), id);
  }

  public static ActivityEvent withId(ActivityEvent event, long id) {
    try {
      var idField = ActivityEvent.class.getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(event, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set activity event ID", e);
    }
    return event;
  }

  private TestActivityEventFactory() {}
}
