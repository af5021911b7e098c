package io.estatekeeper.backend.estate;

import io.estatekeeper.backend.exception.EstateEditDeniedException;
import io.estatekeeper.backend.exception.EstateNotFoundException;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Gate used by the HTTP layer before it touches a single estate's activity. Non-members get a 404
 * rather than a 403 so estate ids cannot be discovered.
 */
@Service
public class EstateAccessService {

  private final EstateMembershipDirectory membershipDirectory;

  public EstateAccessService(EstateMembershipDirectory membershipDirectory) {
    this.membershipDirectory = membershipDirectory;
  }

  public EstateRole requireViewAccess(UUID estateId, String userId) {
    return membershipDirectory
        .findRole(estateId, userId)
        .orElseThrow(() -> new EstateNotFoundException(estateId));
  }

  public EstateRole requireEditAccess(UUID estateId, String userId) {
    var role = requireViewAccess(estateId, userId);
    if (!role.atLeast(EstateRole.EDITOR)) {
      throw new EstateEditDeniedException(estateId, role);
    }
    return role;
  }
}
