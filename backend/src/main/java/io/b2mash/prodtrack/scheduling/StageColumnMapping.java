package io.b2mash.prodtrack.scheduling;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Binds pipeline statuses to the job date columns they schedule. */
public final class StageColumnMapping {

  private final StatusPipeline pipeline;
  private final Map<DateColumn, Stage> stagesByColumn;

  private StageColumnMapping(StatusPipeline pipeline, Map<DateColumn, Stage> stagesByColumn) {
    this.pipeline = pipeline;
    this.stagesByColumn = stagesByColumn;
  }

  public static StageColumnMapping of(
      StatusPipeline pipeline, Map<String, DateColumn> columnsByStageName) {
    var stagesByColumn = new EnumMap<DateColumn, Stage>(DateColumn.class);
    columnsByStageName.forEach(
        (stageName, column) ->
            pipeline.find(stageName).ifPresent(stage -> stagesByColumn.putIfAbsent(column, stage)));
    return new StageColumnMapping(pipeline, stagesByColumn);
  }

  public Optional<Stage> stageFor(DateColumn column) {
    return Optional.ofNullable(stagesByColumn.get(column));
  }

  /**
   * The status whose date anchors backward scheduling: the one mapped to the delivery column, or
   * the final status when none is mapped.
   */
  public Stage anchorStage() {
    return stageFor(DateColumn.DELIVERY).orElseGet(pipeline::finalStage);
  }

  /** Mapped upstream columns and their statuses, excluding the anchor. */
  public Map<DateColumn, Stage> upstreamStages() {
    Stage anchor = anchorStage();
    var upstream = new EnumMap<DateColumn, Stage>(DateColumn.class);
    stagesByColumn.forEach(
        (column, stage) -> {
          if (column != DateColumn.DELIVERY && stage.id() != anchor.id()) {
            upstream.put(column, stage);
          }
        });
    return upstream;
  }

  /** Date columns highlighted while a job is in {@code stage}. Unknown column keys are skipped. */
  public static List<DateColumn> activeColumns(Stage stage) {
    var columns = new ArrayList<DateColumn>();
    for (ColumnTarget target : stage.targetColumns()) {
      for (DateColumn column : DateColumn.values()) {
        if (column.key().equalsIgnoreCase(target.column()) && !columns.contains(column)) {
          columns.add(column);
        }
      }
    }
    return columns;
  }
}
