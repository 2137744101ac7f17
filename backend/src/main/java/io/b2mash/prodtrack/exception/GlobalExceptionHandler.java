package io.b2mash.prodtrack.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    return problem(
        HttpStatus.FORBIDDEN,
        "Access denied",
        "Only administrators and managers can change scheduling configuration");
  }

  /** Logged at ERROR: scheduling stays broken until someone fixes statuses or lead times. */
  @ExceptionHandler(PipelineConfigurationException.class)
  public ResponseEntity<ProblemDetail> handlePipelineConfiguration(
      PipelineConfigurationException ex, HttpServletRequest request) {
    log.error(
        "Pipeline configuration error: path={}, detail={}",
        request.getRequestURI(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  /** Stale job versions and serialization failures of repeatable-read scheduling transactions. */
  @ExceptionHandler(ConcurrencyFailureException.class)
  public ResponseEntity<ProblemDetail> handleConcurrencyFailure(ConcurrencyFailureException ex) {
    log.warn("Concurrent update: {}", ex.getMessage());
    return problem(
        HttpStatus.CONFLICT,
        "Concurrent modification",
        "The data was changed by someone else. Please retry.");
  }

  /** Unique and foreign-key races that slipped past the service-level checks. */
  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrity(
      DataIntegrityViolationException ex, HttpServletRequest request) {
    log.warn(
        "Constraint violation: path={}, cause={}",
        request.getRequestURI(),
        ex.getMostSpecificCause().getMessage());
    return problem(
        HttpStatus.CONFLICT,
        "Conflicting change",
        "The change conflicts with existing statuses, lead times, holidays or jobs");
  }

  private static ResponseEntity<ProblemDetail> problem(
      HttpStatus status, String title, String detail) {
    return ResponseEntity.status(status).body(ProblemDetails.of(status, title, detail));
  }
}
