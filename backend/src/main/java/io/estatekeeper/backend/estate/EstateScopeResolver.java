package io.estatekeeper.backend.estate;

import io.estatekeeper.backend.exception.ScopeResolutionException;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Resolves the set of estates an activity read may cover.
 *
 * <p>An explicit estate id is only syntax-checked: the caller has already enforced membership
 * before reaching the feed. Without one, the scope is every estate the user owns or collaborates
 * on.
 */
@Component
public class EstateScopeResolver {

  private static final Logger log = LoggerFactory.getLogger(EstateScopeResolver.class);

  private final EstateMembershipDirectory membershipDirectory;

  public EstateScopeResolver(EstateMembershipDirectory membershipDirectory) {
    this.membershipDirectory = membershipDirectory;
  }

  /**
   * @param userId the authenticated user id
   * @param explicitEstateId optional single estate; a malformed value resolves to an empty scope
   * @return the estate ids to read from; never null
   * @throws ScopeResolutionException if the membership store cannot be queried
   */
  public Set<UUID> resolveTenantScope(String userId, String explicitEstateId) {
    if (explicitEstateId != null && !explicitEstateId.isBlank()) {
      var parsed = EstateIds.parse(explicitEstateId);
      if (parsed.isEmpty()) {
        log.debug("Ignoring malformed estate id in feed request: {}", explicitEstateId);
        return Set.of();
      }
      return Set.of(parsed.get());
    }

    if (userId == null || userId.isBlank()) {
      return Set.of();
    }

    try {
      return Set.copyOf(membershipDirectory.findAccessibleEstateIds(userId));
    } catch (DataAccessException | TransactionException e) {
      throw new ScopeResolutionException(e);
    }
  }
}
