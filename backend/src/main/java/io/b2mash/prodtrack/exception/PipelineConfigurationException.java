package io.b2mash.prodtrack.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * The configured status pipeline or lead-time rules cannot be used for scheduling: zero or several
 * default/final statuses, clashing order indexes, or a rule pointing at a status that does not
 * exist. Not recoverable without an operator fixing the configuration.
 */
public class PipelineConfigurationException extends ErrorResponseException {

  private static final String TITLE = "Pipeline misconfigured";

  public PipelineConfigurationException(String detail) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ProblemDetails.of(HttpStatus.UNPROCESSABLE_ENTITY, TITLE, detail),
        null);
  }
}
