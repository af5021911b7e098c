package io.estatekeeper.backend.activity;

/**
 * Outcome of a best-effort append. A failed append has already been logged; callers carry on with
 * their own operation either way.
 *
 * @param eventId id of the stored event; null when the append failed
 * @param failureReason short description of the storage failure; null when recorded
 */
public record AppendResult(Long eventId, String failureReason) {

  public static AppendResult recorded(long eventId) {
    return new AppendResult(eventId, null);
  }

  public static AppendResult failed(String failureReason) {
    return new AppendResult(null, failureReason != null ? failureReason : "unknown");
  }

  public boolean isRecorded() {
    return eventId != null;
  }
}
