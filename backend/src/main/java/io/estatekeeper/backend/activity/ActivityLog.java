package io.estatekeeper.backend.activity;

import io.estatekeeper.backend.estate.EstateIds;
import io.estatekeeper.backend.exception.InvalidIdentifierException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Write side of the activity log. Appends are best-effort: the domain operation that produced the
 * event has already succeeded, so a storage failure is logged and reported through {@link
 * AppendResult} instead of being thrown.
 *
 * <p>Each append runs in its own transaction ({@code REQUIRES_NEW}) so that a failed insert never
 * marks the caller's transaction rollback-only. A timed-out append is not retried; losing an event
 * is preferred to writing it twice.
 */
@Service
public class ActivityLog {

  private static final Logger log = LoggerFactory.getLogger(ActivityLog.class);

  static final String DEFAULT_CATEGORY = "OTHER";
  static final String DEFAULT_ACTION = "UNKNOWN";
  static final String ACTOR_ID_KEY = "actor_id";

  private final ActivityEventRepository activityEventRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ActivityLog(
      ActivityEventRepository activityEventRepository,
      PlatformTransactionManager transactionManager,
      ActivityProperties properties,
      Clock clock) {
    this.activityEventRepository = activityEventRepository;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.transactionTemplate.setTimeout(properties.appendTimeoutSeconds());
  }

  /**
   * Appends one event.
   *
   * @throws InvalidIdentifierException if {@code estateId} is not a valid estate id; nothing is
   *     written
   */
  public AppendResult append(
      String estateId,
      String category,
      String action,
      String message,
      String subjectId,
      String subjectType,
      Map<String, Object> detail) {
    return append(
        ActivityEventBuilder.builder()
            .estateId(estateId)
            .category(category)
            .action(action)
            .message(message)
            .subject(subjectId, subjectType)
            .detail(detail)
            .build());
  }

  /**
   * Appends one event built with {@link ActivityEventBuilder}.
   *
   * @throws InvalidIdentifierException if the record's estate id is not a valid estate id; nothing
   *     is written
   */
  public AppendResult append(ActivityEventRecord record) {
    UUID estateId = EstateIds.require(record.estateId());
    var event = new ActivityEvent(estateId, normalize(record), now());

    try {
      ActivityEvent saved =
          transactionTemplate.execute(status -> activityEventRepository.save(event));
      log.debug(
          "Recorded activity event: id={}, estate={}, category={}, action={}",
          saved.getId(),
          estateId,
          event.getCategory(),
          event.getAction());
      return AppendResult.recorded(saved.getId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record activity event: estate={}, category={}, action={}",
          estateId,
          event.getCategory(),
          event.getAction(),
          e);
      return AppendResult.failed(e.getMessage());
    }
  }

  /** Postgres stores microseconds; truncating here keeps the in-memory value equal to the row. */
  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }

  /**
   * Fills in defaults for absent fields. Present values are stored exactly as given: no trimming,
   * no truncation, no vocabulary check. Blank counts as absent.
   */
  private static ActivityEventRecord normalize(ActivityEventRecord record) {
    return new ActivityEventRecord(
        record.estateId(),
        orDefault(record.category(), DEFAULT_CATEGORY),
        orDefault(record.action(), DEFAULT_ACTION),
        record.message() != null ? record.message() : "",
        orDefault(record.subjectId(), null),
        orDefault(record.subjectType(), null),
        orDefault(record.href(), null),
        orDefault(record.sublabel(), null),
        record.actorId(),
        mergeActor(record.detail(), record.actorId()));
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  /** Adds {@code actor_id} unless the producer already put one in the payload. */
  private static Map<String, Object> mergeActor(Map<String, Object> detail, String actorId) {
    var merged = new LinkedHashMap<String, Object>(detail != null ? detail : Map.of());
    if (actorId != null && !actorId.isBlank() && !merged.containsKey(ACTOR_ID_KEY)) {
      merged.put(ACTOR_ID_KEY, actorId);
    }
    return merged.isEmpty() ? null : merged;
  }
}
