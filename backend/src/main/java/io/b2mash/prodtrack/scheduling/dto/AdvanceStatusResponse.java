package io.b2mash.prodtrack.scheduling.dto;

import io.b2mash.prodtrack.scheduling.Stage;

public record AdvanceStatusResponse(long nextStageId, String name, String displayName) {

  public static AdvanceStatusResponse from(Stage stage) {
    return new AdvanceStatusResponse(stage.id(), stage.name(), stage.displayName());
  }
}
