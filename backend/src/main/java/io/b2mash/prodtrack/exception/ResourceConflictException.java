package io.b2mash.prodtrack.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, ProblemDetails.of(HttpStatus.CONFLICT, title, detail), null);
  }

  /** A unique value ({@code name}, {@code date}, ...) that another row already holds. */
  public static ResourceConflictException duplicate(
      String resourceType, String field, Object value) {
    return new ResourceConflictException(
        "Duplicate " + resourceType,
        "A " + resourceType + " with " + field + " '" + value + "' already exists");
  }
}
