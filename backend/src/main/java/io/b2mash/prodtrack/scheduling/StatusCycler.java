package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.exception.InvalidScheduleInputException;
import io.b2mash.prodtrack.exception.PipelineConfigurationException;

/**
 * Cyclic status state machine. Advancing moves a job to the next status in pipeline order; the
 * status after the last one is the first one again, so a reworked job starts over.
 */
public final class StatusCycler {

  private StatusCycler() {}

  /** Status a newly created job starts in. */
  public static Stage initialStage(StatusPipeline pipeline) {
    return pipeline.defaultStage();
  }

  /**
   * @throws InvalidScheduleInputException if {@code currentStageId} is not in the pipeline
   * @throws PipelineConfigurationException if the pipeline has no statuses
   */
  public static Stage advance(StatusPipeline pipeline, long currentStageId) {
    if (pipeline.isEmpty()) {
      throw new PipelineConfigurationException("No job statuses are configured");
    }
    int index = pipeline.indexOf(currentStageId);
    if (index < 0) {
      throw InvalidScheduleInputException.unknownStage(currentStageId);
    }
    return pipeline.orderedStages().get((index + 1) % pipeline.size());
  }
}
