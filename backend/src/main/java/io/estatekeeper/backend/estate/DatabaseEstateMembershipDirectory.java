package io.estatekeeper.backend.estate;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link EstateMembershipDirectory} backed by the {@code estates} and collaborator tables. */
@Service
public class DatabaseEstateMembershipDirectory implements EstateMembershipDirectory {

  private final EstateRepository estateRepository;
  private final EstateCollaboratorRepository collaboratorRepository;

  public DatabaseEstateMembershipDirectory(
      EstateRepository estateRepository, EstateCollaboratorRepository collaboratorRepository) {
    this.estateRepository = estateRepository;
    this.collaboratorRepository = collaboratorRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public Set<UUID> findAccessibleEstateIds(String userId) {
    return new LinkedHashSet<>(estateRepository.findAccessibleEstateIds(userId));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EstateRole> findRole(UUID estateId, String userId) {
    var estate = estateRepository.findById(estateId);
    if (estate.isEmpty()) {
      return Optional.empty();
    }
    if (estate.get().getOwnerId().equals(userId)) {
      return Optional.of(EstateRole.OWNER);
    }
    return collaboratorRepository
        .findByEstateIdAndUserId(estateId, userId)
        .map(EstateCollaborator::getRole);
  }
}
