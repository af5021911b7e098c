package io.estatekeeper.backend.activity;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Keyset queries over {@code activity_events}. The unfiltered queries are served by the
 * {@code (estate_id, created_at DESC, id DESC)} index, the category-filtered ones by
 * {@code (estate_id, category, created_at DESC, id DESC)}. Callers pass an unsorted page request
 * with offset 0; its size is the row limit.
 */
public interface ActivityEventRepository extends JpaRepository<ActivityEvent, Long> {

  /** Newest events across the given estates. */
  @Query(
      """
      SELECT e FROM ActivityEvent e
      WHERE e.estateId IN :estateIds
      ORDER BY e.createdAt DESC, e.id DESC
      """)
  List<ActivityEvent> findLatest(
      @Param("estateIds") Collection<UUID> estateIds, Pageable pageable);

  /**
   * Events strictly before {@code (cursorAt, cursorId)} in {@code (createdAt DESC, id DESC)}
   * order. The {@code id} comparison breaks ties between events sharing a timestamp.
   */
  @Query(
      """
      SELECT e FROM ActivityEvent e
      WHERE e.estateId IN :estateIds
        AND (e.createdAt < :cursorAt OR (e.createdAt = :cursorAt AND e.id < :cursorId))
      ORDER BY e.createdAt DESC, e.id DESC
      """)
  List<ActivityEvent> findBefore(
      @Param("estateIds") Collection<UUID> estateIds,
      @Param("cursorAt") Instant cursorAt,
      @Param("cursorId") long cursorId,
      Pageable pageable);

  /** {@link #findLatest} restricted to events whose stored category is in {@code categories}. */
  @Query(
      """
      SELECT e FROM ActivityEvent e
      WHERE e.estateId IN :estateIds
        AND e.category IN :categories
      ORDER BY e.createdAt DESC, e.id DESC
      """)
  List<ActivityEvent> findLatestInCategories(
      @Param("estateIds") Collection<UUID> estateIds,
      @Param("categories") Collection<String> categories,
      Pageable pageable);

  /** {@link #findBefore} restricted to events whose stored category is in {@code categories}. */
  @Query(
      """
      SELECT e FROM ActivityEvent e
      WHERE e.estateId IN :estateIds
        AND e.category IN :categories
        AND (e.createdAt < :cursorAt OR (e.createdAt = :cursorAt AND e.id < :cursorId))
      ORDER BY e.createdAt DESC, e.id DESC
      """)
  List<ActivityEvent> findBeforeInCategories(
      @Param("estateIds") Collection<UUID> estateIds,
      @Param("categories") Collection<String> categories,
      @Param("cursorAt") Instant cursorAt,
      @Param("cursorId") long cursorId,
      Pageable pageable);
}
