package io.estatekeeper.backend.activity;

import io.estatekeeper.backend.estate.EstateAccessService;
import io.estatekeeper.backend.estate.EstateIds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the activity feeds and estate timeline notes. */
@RestController
public class ActivityController {

  private final ActivityFeedService activityFeedService;
  private final ActivityLog activityLog;
  private final EstateAccessService estateAccessService;

  public ActivityController(
      ActivityFeedService activityFeedService,
      ActivityLog activityLog,
      EstateAccessService estateAccessService) {
    this.activityFeedService = activityFeedService;
    this.activityLog = activityLog;
    this.estateAccessService = estateAccessService;
  }

  /**
   * Returns the caller's activity feed: every estate they own or collaborate on, or a single
   * estate when {@code estateId} is given.
   *
   * @param estateId optional estate filter; the caller must be its owner or a collaborator
   * @param categories optional stored categories, comma-separated or repeated
   * @param cursor opaque cursor from a previous response
   * @param limit page size (default 25, max 100)
   */
  @GetMapping("/api/activity")
  public ResponseEntity<ActivityFeed> getActivity(
      @AuthenticationPrincipal Jwt jwt,
      @RequestParam(required = false) String estateId,
      @RequestParam(required = false) List<String> categories,
      @RequestParam(required = false) String cursor,
      @RequestParam(required = false) Integer limit) {

    String userId = jwt.getSubject();
    if (estateId != null && !estateId.isBlank()) {
      estateAccessService.requireViewAccess(EstateIds.require(estateId), userId);
    }

    return ResponseEntity.ok(
        activityFeedService.listEvents(
            userId, estateId, categoryFilter(categories), cursor, limit));
  }

  /**
   * Returns the activity timeline of one estate. Non-members get 404.
   *
   * @param categories optional stored categories, either {@code categories=TASK,NOTE} or the
   *     parameter repeated
   */
  @GetMapping("/api/estates/{estateId}/activity")
  public ResponseEntity<ActivityFeed> getEstateActivity(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable String estateId,
      @RequestParam(required = false) List<String> categories,
      @RequestParam(required = false) String cursor,
      @RequestParam(required = false) Integer limit) {

    String userId = jwt.getSubject();
    UUID id = EstateIds.require(estateId);
    estateAccessService.requireViewAccess(id, userId);

    return ResponseEntity.ok(
        activityFeedService.listEvents(
            userId, id.toString(), categoryFilter(categories), cursor, limit));
  }

  /**
   * Adds a free-text note to an estate's timeline. Requires owner or editor access. Answers 202
   * instead of 201 when the note could not be stored; the request itself is still accepted.
   */
  @PostMapping("/api/estates/{estateId}/activity")
  public ResponseEntity<NoteResponse> addNote(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable String estateId,
      @Valid @RequestBody AddNoteRequest request) {

    String userId = jwt.getSubject();
    UUID id = EstateIds.require(estateId);
    estateAccessService.requireEditAccess(id, userId);

    String note = request.note().trim();
    var detail = new LinkedHashMap<String, Object>();
    detail.put("note", note);
    if (request.meta() != null && !request.meta().isEmpty()) {
      detail.put("meta", request.meta());
    }

    var result =
        activityLog.append(
            ActivityEventBuilder.builder()
                .estateId(id.toString())
                .category("NOTE")
                .action("created")
                .message("Note added")
                .sublabel(note)
                .actorId(userId)
                .detail(detail)
                .build());

    HttpStatus status = result.isRecorded() ? HttpStatus.CREATED : HttpStatus.ACCEPTED;
    return ResponseEntity.status(status).body(new NoteResponse(result.eventId()));
  }

  /** Trims each value and drops blanks; Spring has already split comma-separated values. */
  private static Set<String> categoryFilter(List<String> categories) {
    if (categories == null) {
      return Set.of();
    }
    var filter = new LinkedHashSet<String>();
    for (String category : categories) {
      if (category != null && !category.isBlank()) {
        filter.add(category.trim());
      }
    }
    return filter;
  }

  // --- DTOs ---

  public record AddNoteRequest(
      @NotBlank(message = "note is required")
          @Size(max = 5000, message = "note must be at most 5000 characters")
          String note,
      Map<String, Object> meta) {}

  public record NoteResponse(Long id) {}
}
