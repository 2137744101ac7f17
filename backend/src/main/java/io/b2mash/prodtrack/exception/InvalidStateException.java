package io.b2mash.prodtrack.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A request that is well-formed but not acceptable for the current configuration. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, ProblemDetails.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
