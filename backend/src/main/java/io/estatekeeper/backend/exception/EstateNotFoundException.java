package io.estatekeeper.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The estate does not exist or the caller is neither its owner nor a collaborator. Both cases
 * answer the same way.
 */
public class EstateNotFoundException extends ErrorResponseException {

  private final UUID estateId;

  public EstateNotFoundException(UUID estateId) {
    super(HttpStatus.NOT_FOUND, createProblem(estateId), null);
    this.estateId = estateId;
  }

  public UUID getEstateId() {
    return estateId;
  }

  @Override
  public String getMessage() {
    return "Estate not found: " + estateId;
  }

  private static ProblemDetail createProblem(UUID estateId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Estate not found");
    problem.setDetail("No estate found with id " + estateId);
    return problem;
  }
}
