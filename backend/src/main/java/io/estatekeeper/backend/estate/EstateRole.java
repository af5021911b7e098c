package io.estatekeeper.backend.estate;

/** Access level of a user on an estate, ordered from least to most privileged. */
public enum EstateRole {
  VIEWER,
  EDITOR,
  OWNER;

  public boolean atLeast(EstateRole required) {
    return compareTo(required) >= 0;
  }
}
