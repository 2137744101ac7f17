package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.exception.PipelineConfigurationException;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable view of the configured job statuses. Stages are sorted ascending by {@code
 * orderIndex}; position in {@link #orderedStages()} is the pipeline position used by the status
 * cycler.
 */
public final class StatusPipeline {

  private final List<Stage> stages;

  private StatusPipeline(List<Stage> stages) {
    this.stages = stages;
  }

  /**
   * Builds a pipeline from stages in any order.
   *
   * @throws PipelineConfigurationException if two stages share an order index or an id
   */
  public static StatusPipeline of(List<Stage> stages) {
    var sorted = stages.stream().sorted(Comparator.comparingInt(Stage::orderIndex)).toList();

    Set<Integer> orderIndexes = new HashSet<>();
    Set<Long> ids = new HashSet<>();
    for (Stage stage : sorted) {
      if (!orderIndexes.add(stage.orderIndex())) {
        throw new PipelineConfigurationException(
            "Order index " + stage.orderIndex() + " is used by more than one status");
      }
      if (!ids.add(stage.id())) {
        throw new PipelineConfigurationException("Status id " + stage.id() + " appears twice");
      }
    }
    return new StatusPipeline(sorted);
  }

  public List<Stage> orderedStages() {
    return stages;
  }

  public int size() {
    return stages.size();
  }

  public boolean isEmpty() {
    return stages.isEmpty();
  }

  public Optional<Stage> find(String name) {
    return stages.stream().filter(s -> s.name().equals(name)).findFirst();
  }

  public Optional<Stage> findById(long stageId) {
    return stages.stream().filter(s -> s.id() == stageId).findFirst();
  }

  /** Position of the stage in pipeline order, or -1 when the id is unknown. */
  public int indexOf(long stageId) {
    for (int i = 0; i < stages.size(); i++) {
      if (stages.get(i).id() == stageId) {
        return i;
      }
    }
    return -1;
  }

  /**
   * @throws PipelineConfigurationException unless exactly one stage is flagged default
   */
  public Stage defaultStage() {
    return exactlyOne(stages.stream().filter(Stage::isDefault).toList(), "default");
  }

  /**
   * @throws PipelineConfigurationException unless exactly one stage is flagged final
   */
  public Stage finalStage() {
    return exactlyOne(stages.stream().filter(Stage::isFinal).toList(), "final");
  }

  private static Stage exactlyOne(List<Stage> candidates, String flag) {
    if (candidates.size() != 1) {
      throw new PipelineConfigurationException(
          "Expected exactly one "
              + flag
              + " status but found "
              + candidates.size()
              + (candidates.isEmpty()
                  ? ""
                  : ": " + candidates.stream().map(Stage::name).toList()));
    }
    return candidates.get(0);
  }
}
