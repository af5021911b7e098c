package io.estatekeeper.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a caller supplies an identifier that is not syntactically valid (for example an
 * estate id that is not a UUID). Nothing is written when this is raised.
 */
public class InvalidIdentifierException extends ErrorResponseException {

  private final String identifierType;
  private final String value;

  public InvalidIdentifierException(String identifierType, String value) {
    super(HttpStatus.BAD_REQUEST, createProblem(identifierType, value), null);
    this.identifierType = identifierType;
    this.value = value;
  }

  public String getIdentifierType() {
    return identifierType;
  }

  public String getValue() {
    return value;
  }

  @Override
  public String getMessage() {
    return "Invalid " + identifierType + ": " + value;
  }

  private static ProblemDetail createProblem(String identifierType, String value) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid " + identifierType);
    problem.setDetail("'" + value + "' is not a valid " + identifierType);
    return problem;
  }
}
