package io.estatekeeper.backend.activity;

/** Visual tone of a feed item. Each tone names the palette colour the front end renders it in. */
public enum ActivityTone {
  ALERT("rose"),
  SUCCESS("emerald"),
  WARNING("amber"),
  NEUTRAL("slate");

  private final String palette;

  ActivityTone(String palette) {
    this.palette = palette;
  }

  public String palette() {
    return palette;
  }

  public static ActivityTone forCategory(ActivityCategory category) {
    return switch (category) {
      case INVOICE, EXPENSE, RENT -> WARNING;
      case DOCUMENT -> SUCCESS;
      case TASK, COLLABORATION -> ALERT;
      case NOTE, CONTACT, TENANT_LIFECYCLE, OTHER -> NEUTRAL;
    };
  }
}
