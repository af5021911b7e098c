package io.estatekeeper.backend.estate;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of estate ownership and collaboration. The activity log needs set membership
 * only; the role is used by callers that gate writes.
 */
public interface EstateMembershipDirectory {

  /**
   * Returns the ids of every estate where {@code userId} is the owner or a collaborator.
   *
   * @param userId the authenticated user id
   * @return the accessible estate ids; empty if the user has none
   */
  Set<UUID> findAccessibleEstateIds(String userId);

  /**
   * Returns the user's role on the estate: {@link EstateRole#OWNER} for the owner, the
   * collaborator role otherwise, or empty when the user has no access or the estate does not
   * exist.
   */
  Optional<EstateRole> findRole(UUID estateId, String userId);
}
