package io.b2mash.prodtrack.scheduling;

import java.util.List;

/** Immutable snapshot of one job status as seen by the scheduling engine. */
public record Stage(
    long id,
    String name,
    String displayName,
    int orderIndex,
    boolean isDefault,
    boolean isFinal,
    List<ColumnTarget> targetColumns) {

  public Stage {
    targetColumns = targetColumns == null ? List.of() : List.copyOf(targetColumns);
  }
}
