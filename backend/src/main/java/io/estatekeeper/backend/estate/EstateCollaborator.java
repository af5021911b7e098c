package io.estatekeeper.backend.estate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

@Entity
@Table(name = "estate_collaborators")
public class EstateCollaborator {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "estate_id", nullable = false)
  private UUID estateId;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private EstateRole role;

  protected EstateCollaborator() {}

  public EstateCollaborator(UUID estateId, String userId, EstateRole role) {
    this.estateId = estateId;
    this.userId = userId;
    this.role = role;
  }

  public UUID getId() {
    return id;
  }

  public UUID getEstateId() {
    return estateId;
  }

  public String getUserId() {
    return userId;
  }

  public EstateRole getRole() {
    return role;
  }
}
