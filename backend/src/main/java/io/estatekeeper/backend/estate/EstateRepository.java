package io.estatekeeper.backend.estate;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EstateRepository extends JpaRepository<Estate, UUID> {

  /** Ids of every estate the user owns or collaborates on. */
  @Query(
      """
      SELECT e.id FROM Estate e
      WHERE e.ownerId = :userId
         OR e.id IN (SELECT c.estateId FROM EstateCollaborator c WHERE c.userId = :userId)
      """)
  List<UUID> findAccessibleEstateIds(@Param("userId") String userId);
}
