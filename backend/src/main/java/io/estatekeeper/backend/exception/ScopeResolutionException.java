package io.estatekeeper.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when the estate-membership store cannot tell which estates a user may read. No feed is
 * shown in that case: a partial scope would produce an incorrect feed.
 */
public class ScopeResolutionException extends ErrorResponseException {

  public ScopeResolutionException(Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(), cause);
  }

  @Override
  public String getMessage() {
    return "Unable to resolve estate scope";
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Unable to load recent activity");
    problem.setDetail("Unable to load recent activity, try again");
    return problem;
  }
}
