package io.estatekeeper.backend.activity;

import java.util.Map;

/**
 * Non-JPA DTO passed to {@link ActivityLog#append(ActivityEventRecord)}. Constructed by {@link
 * ActivityEventBuilder}, which fills {@code actorId} from the authenticated request when it is not
 * set explicitly.
 *
 * @param estateId owning estate as supplied by the producer; validated on append
 * @param category free-form kind (e.g. "invoice", "TASK"); normalized only when read
 * @param action free-form verb (e.g. "created", "status_changed")
 * @param message precomposed human-readable summary; may be empty
 * @param subjectId id of the domain object the event is about; nullable
 * @param subjectType kind of that domain object; nullable
 * @param href explicit deep link overriding the per-category template; nullable
 * @param sublabel secondary display line; nullable
 * @param actorId user who caused the event; merged into {@code detail} as {@code actor_id}
 * @param detail schemaless payload (before/after values etc.); nullable
 */
public record ActivityEventRecord(
    String estateId,
    String category,
    String action,
    String message,
    String subjectId,
    String subjectType,
    String href,
    String sublabel,
    String actorId,
    Map<String, Object> detail) {}
