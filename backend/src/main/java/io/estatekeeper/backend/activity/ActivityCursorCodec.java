package io.estatekeeper.backend.activity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Encodes {@link ActivityCursor}s as opaque strings: URL-safe Base64 (no padding) over a compact
 * JSON object {@code {"at":"<ISO-8601>","id":<n>}}.
 *
 * <p>Decoding is lenient by contract. Anything that does not decode to a valid cursor is treated
 * as "no cursor", so a corrupted token restarts the feed from the newest event.
 */
@Component
public class ActivityCursorCodec {

  private static final Logger log = LoggerFactory.getLogger(ActivityCursorCodec.class);

  private final ObjectMapper objectMapper;

  public ActivityCursorCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(ActivityCursor cursor) {
    var fields = new LinkedHashMap<String, Object>();
    fields.put("at", cursor.at().toString());
    fields.put("id", cursor.id());
    try {
      byte[] json = objectMapper.writeValueAsBytes(fields);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode activity cursor", e);
    }
  }

  public Optional<ActivityCursor> decode(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      byte[] json = Base64.getUrlDecoder().decode(token.trim());
      JsonNode node = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
      if (node == null || !node.isObject()) {
        return rejected(token);
      }
      JsonNode at = node.get("at");
      JsonNode id = node.get("id");
      if (at == null || !at.isTextual() || id == null || !id.canConvertToLong()) {
        return rejected(token);
      }
      if (!id.isIntegralNumber() || id.asLong() <= 0) {
        return rejected(token);
      }
      return Optional.of(new ActivityCursor(Instant.parse(at.asText()), id.asLong()));
    } catch (IllegalArgumentException | DateTimeParseException | IOException e) {
      return rejected(token);
    }
  }

  private static Optional<ActivityCursor> rejected(String token) {
    log.debug("Ignoring malformed activity cursor: {}", token);
    return Optional.empty();
  }
}
