package io.estatekeeper.backend.activity;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Maps stored activity events to feed items. Stateless and total: missing data falls back to the
 * least specific value that is always valid (the estate overview link, no badge).
 */
@Component
public class ActivityPresenter {

  public PresentedActivity present(ActivityEvent event) {
    ActivityCategory category =
        ActivityCategory.normalize(
            event.getSubjectType(), event.getCategory(), event.getAction());

    return new PresentedActivity(
        String.valueOf(event.getId()),
        event.getEstateId(),
        event.getCreatedAt(),
        label(event),
        sublabel(event),
        href(event, category),
        category,
        ActivityTone.forCategory(category),
        badge(event, category));
  }

  private String label(ActivityEvent event) {
    String message = event.getMessage();
    if (message != null && !message.isBlank()) {
      return message.trim();
    }
    return "%s: %s".formatted(event.getCategory(), event.getAction());
  }

  private String sublabel(ActivityEvent event) {
    if (hasText(event.getSublabel())) {
      return event.getSublabel();
    }
    return hasText(event.getSubjectType()) ? event.getSubjectType() : null;
  }

  private String badge(ActivityEvent event, ActivityCategory category) {
    if (category != ActivityCategory.OTHER) {
      return category.name();
    }
    String action = event.getAction();
    return hasText(action) ? action.replace('_', ' ') : null;
  }

  String href(ActivityEvent event, ActivityCategory category) {
    if (hasText(event.getHref())) {
      return event.getHref().trim();
    }

    String estate = "/app/estates/" + segment(event.getEstateId());
    if (category == ActivityCategory.COLLABORATION) {
      return estate + "/collaborators";
    }

    String subjectId = event.getSubjectId();
    if (!hasText(subjectId)) {
      return estate;
    }

    return switch (category) {
      case DOCUMENT -> estate + "/documents/" + segment(subjectId);
      case NOTE -> estate + "/notes?focus=" + queryParam(subjectId);
      case TASK -> estate + "/tasks?focus=" + queryParam(subjectId);
      case INVOICE -> estate + "/invoices?focus=" + queryParam(subjectId);
      case EXPENSE -> estate + "/expenses/" + segment(subjectId);
      case RENT -> estate + "/rent/" + segment(subjectId);
      case CONTACT -> "/app/contacts/" + segment(subjectId);
      default -> estate;
    };
  }

  private static String segment(UUID id) {
    return id.toString();
  }

  private static String segment(String value) {
    return UriUtils.encodePathSegment(value.trim(), StandardCharsets.UTF_8);
  }

  private static String queryParam(String value) {
    return UriUtils.encodeQueryParam(value.trim(), StandardCharsets.UTF_8);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
