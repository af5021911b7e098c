package io.estatekeeper.backend.activity;

import java.util.Map;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Builder that constructs an {@link ActivityEventRecord}.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * ActivityEventRecord record = ActivityEventBuilder.builder()
 *     .estateId(estate.getId().toString())
 *     .category("INVOICE")
 *     .action("status_changed")
 *     .message("Invoice INV-7 marked paid")
 *     .subject(invoice.getId().toString(), "invoice")
 *     .detail(Map.of("from", "SENT", "to", "PAID"))
 *     .build();
 * }</pre>
 */
public class ActivityEventBuilder {

  private String estateId;
  private String category;
  private String action;
  private String message;
  private String subjectId;
  private String subjectType;
  private String href;
  private String sublabel;
  private String actorId;
  private Map<String, Object> detail;

  private boolean actorIdExplicitlySet;

  private ActivityEventBuilder() {}

  /** Creates a new builder instance. */
  public static ActivityEventBuilder builder() {
    return new ActivityEventBuilder();
  }

  public ActivityEventBuilder estateId(String estateId) {
    this.estateId = estateId;
    return this;
  }

  public ActivityEventBuilder category(String category) {
    this.category = category;
    return this;
  }

  public ActivityEventBuilder action(String action) {
    this.action = action;
    return this;
  }

  public ActivityEventBuilder message(String message) {
    this.message = message;
    return this;
  }

  public ActivityEventBuilder subject(String subjectId, String subjectType) {
    this.subjectId = subjectId;
    this.subjectType = subjectType;
    return this;
  }

  public ActivityEventBuilder href(String href) {
    this.href = href;
    return this;
  }

  public ActivityEventBuilder sublabel(String sublabel) {
    this.sublabel = sublabel;
    return this;
  }

  public ActivityEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public ActivityEventBuilder detail(Map<String, Object> detail) {
    this.detail = detail;
    return this;
  }

  /**
   * Builds the record. When {@code actorId} was not set explicitly it is taken from the subject of
   * the current JWT, if the calling thread is serving an authenticated request.
   */
  public ActivityEventRecord build() {
    String resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth instanceof JwtAuthenticationToken jwtAuth) {
        resolvedActorId = jwtAuth.getToken().getSubject();
      }
    }

    return new ActivityEventRecord(
        estateId,
        category,
        action,
        message,
        subjectId,
        subjectType,
        href,
        sublabel,
        resolvedActorId,
        detail);
  }
}
