package io.estatekeeper.backend.activity;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.UUID;

/**
 * Feed item returned to clients. Everything except {@code id}, {@code estateId} and {@code
 * timestamp} is derived at read time by {@link ActivityPresenter}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresentedActivity(
    String id,
    UUID estateId,
    Instant timestamp,
    String label,
    String sublabel,
    String href,
    ActivityCategory category,
    ActivityTone tone,
    String badge) {}
