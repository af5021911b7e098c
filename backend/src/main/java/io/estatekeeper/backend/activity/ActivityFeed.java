package io.estatekeeper.backend.activity;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Response body of the feed endpoints. {@code nextCursor} is opaque and omitted on the last page.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActivityFeed(List<PresentedActivity> items, String nextCursor) {}
