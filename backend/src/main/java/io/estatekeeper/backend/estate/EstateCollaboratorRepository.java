package io.estatekeeper.backend.estate;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EstateCollaboratorRepository extends JpaRepository<EstateCollaborator, UUID> {

  Optional<EstateCollaborator> findByEstateIdAndUserId(UUID estateId, String userId);
}
