package io.estatekeeper.backend.estate;

import io.estatekeeper.backend.exception.InvalidIdentifierException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Syntax checks for estate identifiers. Only the canonical 36-character UUID form is accepted;
 * {@link UUID#fromString} alone tolerates short forms such as {@code 1-2-3-4-5}.
 */
public final class EstateIds {

  private static final Pattern CANONICAL_UUID =
      Pattern.compile(
          "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  /** Returns the parsed id, or empty when {@code raw} is null, blank or malformed. */
  public static Optional<UUID> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String trimmed = raw.trim();
    if (!CANONICAL_UUID.matcher(trimmed).matches()) {
      return Optional.empty();
    }
    return Optional.of(UUID.fromString(trimmed));
  }

  /** Returns the parsed id or throws {@link InvalidIdentifierException}. */
  public static UUID require(String raw) {
    return parse(raw).orElseThrow(() -> new InvalidIdentifierException("estate id", raw));
  }

  private EstateIds() {}
}
