package io.estatekeeper.backend.activity;

import io.estatekeeper.backend.estate.EstateScopeResolver;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Read side of the activity log: keyset pagination over {@code (createdAt DESC, id DESC)}.
 *
 * <p>Each page asks the store for {@code limit + 1} rows strictly before the cursor. The extra row
 * only signals that an older page exists; it is never returned. Because the predicate looks only
 * backwards from the cursor, events inserted after the first page was read never show up in later
 * pages of the same scan, and no page repeats a row of an earlier one.
 *
 * <p>The ordering trusts the writers' clocks. The {@code id} tie-break orders events with equal
 * timestamps; it does not correct a writer whose clock runs behind another's.
 */
@Service
public class ActivityFeedService {

  private static final Logger log = LoggerFactory.getLogger(ActivityFeedService.class);

  private final ActivityEventRepository activityEventRepository;
  private final EstateScopeResolver scopeResolver;
  private final ActivityCursorCodec cursorCodec;
  private final ActivityPresenter presenter;
  private final ActivityProperties.Feed feedProperties;
  private final TransactionTemplate readTransaction;

  public ActivityFeedService(
      ActivityEventRepository activityEventRepository,
      EstateScopeResolver scopeResolver,
      ActivityCursorCodec cursorCodec,
      ActivityPresenter presenter,
      ActivityProperties properties,
      PlatformTransactionManager transactionManager) {
    this.activityEventRepository = activityEventRepository;
    this.scopeResolver = scopeResolver;
    this.cursorCodec = cursorCodec;
    this.presenter = presenter;
    this.feedProperties = properties.feed();
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setReadOnly(true);
    this.readTransaction.setTimeout(feedProperties.queryTimeoutSeconds());
  }

  /** {@link #listEvents(String, String, Set, String, Integer)} without a category filter. */
  public ActivityFeed listEvents(String userId, String estateId, String cursor, Integer limit) {
    return listEvents(userId, estateId, Set.of(), cursor, limit);
  }

  /**
   * Returns a presented feed page for the user.
   *
   * @param userId the authenticated user id
   * @param estateId optional single estate; membership must already have been checked by the
   *     caller. A malformed id yields an empty feed
   * @param categories stored categories to keep, matched exactly; empty keeps every category
   * @param cursor opaque cursor from a previous page; malformed cursors restart from the newest
   *     event
   * @param limit requested page size; defaulted and clamped to the configured maximum
   * @return the page, with {@code nextCursor} only when older events exist
   */
  public ActivityFeed listEvents(
      String userId, String estateId, Set<String> categories, String cursor, Integer limit) {
    Set<UUID> scope = scopeResolver.resolveTenantScope(userId, estateId);
    var decodedCursor = cursorCodec.decode(cursor).orElse(null);
    var page = page(scope, categories, decodedCursor, feedProperties.clampLimit(limit));

    List<PresentedActivity> items = page.events().stream().map(presenter::present).toList();
    String nextCursor = page.hasNext() ? cursorCodec.encode(page.nextCursor()) : null;
    return new ActivityFeed(items, nextCursor);
  }

  /**
   * Reads one page of raw events across {@code scope}.
   *
   * @param scope estate ids to read from; an empty scope returns an empty page without a query
   * @param cursor position to continue after, or null for the newest events
   * @param limit page size, at least 1
   */
  public ActivityPage page(Set<UUID> scope, ActivityCursor cursor, int limit) {
    return page(scope, Set.of(), cursor, limit);
  }

  /**
   * Reads one page of raw events across {@code scope}, keeping only events whose stored category
   * is in {@code categories}. An empty {@code categories} set applies no filter. A cursor from an
   * unfiltered scan stays valid here and the other way round.
   */
  public ActivityPage page(
      Set<UUID> scope, Set<String> categories, ActivityCursor cursor, int limit) {
    if (scope.isEmpty()) {
      return ActivityPage.empty();
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1: " + limit);
    }

    var request = PageRequest.of(0, limit + 1);
    List<ActivityEvent> rows =
        readTransaction.execute(status -> fetch(scope, categories, cursor, request));

    if (rows.size() <= limit) {
      log.debug("Activity page: estates={}, rows={}, last page", scope.size(), rows.size());
      return new ActivityPage(List.copyOf(rows), null);
    }

    List<ActivityEvent> pageRows = List.copyOf(rows.subList(0, limit));
    ActivityCursor next = pageRows.get(pageRows.size() - 1).toCursor();
    log.debug("Activity page: estates={}, rows={}, more available", scope.size(), limit);
    return new ActivityPage(pageRows, next);
  }

  private List<ActivityEvent> fetch(
      Set<UUID> scope, Set<String> categories, ActivityCursor cursor, Pageable pageable) {
    if (categories == null || categories.isEmpty()) {
      return cursor == null
          ? activityEventRepository.findLatest(scope, pageable)
          : activityEventRepository.findBefore(scope, cursor.at(), cursor.id(), pageable);
    }
    return cursor == null
        ? activityEventRepository.findLatestInCategories(scope, categories, pageable)
        : activityEventRepository.findBeforeInCategories(
            scope, categories, cursor.at(), cursor.id(), pageable);
  }
}
