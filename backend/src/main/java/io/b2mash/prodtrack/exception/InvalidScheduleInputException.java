package io.b2mash.prodtrack.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Rejected scheduling input: a malformed date or a status id that is not part of the pipeline. */
public class InvalidScheduleInputException extends ErrorResponseException {

  private static final String TITLE = "Invalid scheduling input";

  public InvalidScheduleInputException(String detail) {
    super(HttpStatus.BAD_REQUEST, ProblemDetails.of(HttpStatus.BAD_REQUEST, TITLE, detail), null);
  }

  public static InvalidScheduleInputException unknownStage(long stageId) {
    return new InvalidScheduleInputException("Status " + stageId + " is not part of the pipeline");
  }
}
