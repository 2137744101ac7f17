package io.b2mash.prodtrack.jobstatus.dto;

import io.b2mash.prodtrack.jobstatus.JobStatus;
import io.b2mash.prodtrack.scheduling.ColumnTarget;
import java.time.Instant;
import java.util.List;

public record JobStatusResponse(
    Long id,
    String name,
    String displayName,
    String color,
    String backgroundColor,
    int orderIndex,
    boolean isDefault,
    boolean isFinal,
    List<ColumnTarget> targetColumns,
    Instant createdAt,
    Instant updatedAt) {

  public static JobStatusResponse from(JobStatus status) {
    return new JobStatusResponse(
        status.getId(),
        status.getName(),
        status.getDisplayName(),
        status.getColor(),
        status.getBackgroundColor(),
        status.getOrderIndex(),
        status.isDefault(),
        status.isFinal(),
        status.getTargetColumns(),
        status.getCreatedAt(),
        status.getUpdatedAt());
  }
}
