package io.estatekeeper.backend.activity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable activity event persisted to the {@code activity_events} table. Once created, events
 * cannot be updated (enforced by a database trigger). No {@code @Version}, no {@code updatedAt}, no
 * setters.
 *
 * <p>{@code (createdAt, id)} is the sort and pagination key. {@code id} comes from an identity
 * column, so among rows with the same {@code createdAt} it follows insertion order.
 */
@Entity
@Table(name = "activity_events")
public class ActivityEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "estate_id", nullable = false, updatable = false)
  private UUID estateId;

  @Column(name = "category", nullable = false, columnDefinition = "text", updatable = false)
  private String category;

  @Column(name = "action", nullable = false, columnDefinition = "text", updatable = false)
  private String action;

  @Column(name = "message", nullable = false, columnDefinition = "text", updatable = false)
  private String message;

  @Column(name = "subject_id", columnDefinition = "text", updatable = false)
  private String subjectId;

  @Column(name = "subject_type", columnDefinition = "text", updatable = false)
  private String subjectType;

  @Column(name = "href", columnDefinition = "text", updatable = false)
  private String href;

  @Column(name = "sublabel", columnDefinition = "text", updatable = false)
  private String sublabel;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "detail", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> detail;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** Protected no-arg constructor required by JPA. */
  protected ActivityEvent() {}

  /**
   * Creates an event for the given estate from an already-normalized record.
   *
   * @param estateId the owning estate
   * @param record normalized producer data; its {@code estateId} and {@code actorId} are ignored
   * @param createdAt server-assigned creation time
   */
  public ActivityEvent(UUID estateId, ActivityEventRecord record, Instant createdAt) {
    this.estateId = estateId;
    this.category = record.category();
    this.action = record.action();
    this.message = record.message();
    this.subjectId = record.subjectId();
    this.subjectType = record.subjectType();
    this.href = record.href();
    this.sublabel = record.sublabel();
    this.detail = record.detail();
    this.createdAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public UUID getEstateId() {
    return estateId;
  }

  public String getCategory() {
    return category;
  }

  public String getAction() {
    return action;
  }

  public String getMessage() {
    return message;
  }

  public String getSubjectId() {
    return subjectId;
  }

  public String getSubjectType() {
    return subjectType;
  }

  public String getHref() {
    return href;
  }

  public String getSublabel() {
    return sublabel;
  }

  public Map<String, Object> getDetail() {
    return detail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** The pagination position of this event. */
  public ActivityCursor toCursor() {
    return new ActivityCursor(createdAt, id);
  }
}
