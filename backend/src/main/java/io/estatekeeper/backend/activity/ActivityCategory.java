package io.estatekeeper.backend.activity;

import java.util.List;
import java.util.Locale;

/**
 * Display categories derived from the free-form fields producers store. This enum is the single
 * mapping table: a new producer vocabulary is supported by adding a term here.
 *
 * <p>Matching is a case-insensitive substring test, applied to {@code subjectType} first, then to
 * the stored {@code category}, then to {@code action}. Within one field the constants are tried in
 * declaration order.
 */
public enum ActivityCategory {
  TASK("task"),
  INVOICE("invoice"),
  EXPENSE("expense"),
  RENT("rent"),
  NOTE("note"),
  DOCUMENT("document", "doc"),
  CONTACT("contact"),
  COLLABORATION("collab", "invite"),
  TENANT_LIFECYCLE("estate", "tenant", "lifecycle"),
  OTHER;

  private final List<String> terms;

  ActivityCategory(String... terms) {
    this.terms = List.of(terms);
  }

  /** Normalizes the stored fields of an event; {@link #OTHER} when nothing matches. */
  public static ActivityCategory normalize(String subjectType, String category, String action) {
    for (String field : new String[] {subjectType, category, action}) {
      ActivityCategory match = match(field);
      if (match != OTHER) {
        return match;
      }
    }
    return OTHER;
  }

  /** The first category whose terms occur in {@code value}, or {@link #OTHER}. */
  static ActivityCategory match(String value) {
    if (value == null || value.isBlank()) {
      return OTHER;
    }
    String lower = value.toLowerCase(Locale.ROOT);
    for (ActivityCategory candidate : values()) {
      for (String term : candidate.terms) {
        if (lower.contains(term)) {
          return candidate;
        }
      }
    }
    return OTHER;
  }
}
