package io.estatekeeper.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ScopeResolutionException.class)
  public ResponseEntity<ProblemDetail> handleScopeResolution(
      ScopeResolutionException ex, HttpServletRequest request) {
    log.error(
        "Estate scope resolution failed: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getCause());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ex.getBody());
  }

  /**
   * Storage failures on the read path. A failed feed read has no safe partial answer, so the
   * caller gets a retryable 503 instead of an incomplete page.
   */
  @ExceptionHandler({DataAccessException.class, TransactionException.class})
  public ResponseEntity<ProblemDetail> handleStorageFailure(
      RuntimeException ex, HttpServletRequest request) {
    log.error(
        "Storage failure: path={}, method={}", request.getRequestURI(), request.getMethod(), ex);
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Unable to load recent activity");
    problem.setDetail("Unable to load recent activity, try again");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler(InvalidIdentifierException.class)
  public ResponseEntity<ProblemDetail> handleInvalidIdentifier(InvalidIdentifierException ex) {
    log.warn("Rejected invalid {}: {}", ex.getIdentifierType(), ex.getValue());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }
}
