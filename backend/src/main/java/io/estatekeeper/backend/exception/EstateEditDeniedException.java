package io.estatekeeper.backend.exception;

import io.estatekeeper.backend.estate.EstateRole;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class EstateEditDeniedException extends ErrorResponseException {

  private final UUID estateId;
  private final EstateRole role;

  public EstateEditDeniedException(UUID estateId, EstateRole role) {
    super(HttpStatus.FORBIDDEN, createProblem(estateId, role), null);
    this.estateId = estateId;
    this.role = role;
  }

  public UUID getEstateId() {
    return estateId;
  }

  public EstateRole getRole() {
    return role;
  }

  @Override
  public String getMessage() {
    return "Role " + role + " cannot edit estate " + estateId;
  }

  private static ProblemDetail createProblem(UUID estateId, EstateRole role) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Cannot edit estate");
    problem.setDetail(
        "A " + role.name().toLowerCase() + " cannot change the timeline of estate " + estateId);
    return problem;
  }
}
