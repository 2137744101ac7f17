package io.b2mash.prodtrack.job.dto;

import io.b2mash.prodtrack.job.Job;
import io.b2mash.prodtrack.scheduling.DateColumn;
import io.b2mash.prodtrack.scheduling.DayMonthYearDates;
import io.b2mash.prodtrack.scheduling.Stage;
import io.b2mash.prodtrack.scheduling.StageColumnMapping;
import java.time.Instant;
import java.util.List;

/**
 * Job with its dates in {@code dd/MM/yyyy}. {@code activeColumns} lists the date columns the
 * current status highlights.
 */
public record JobResponse(
    Long id,
    Long projectId,
    String unit,
    String type,
    String items,
    Long statusId,
    String statusName,
    String statusDisplayName,
    String nestingDate,
    String machiningDate,
    String assemblyDate,
    String deliveryDate,
    List<String> activeColumns,
    String comments,
    Instant createdAt,
    Instant updatedAt) {

  public static JobResponse from(Job job, Stage status) {
    return new JobResponse(
        job.getId(),
        job.getProjectId(),
        job.getUnit(),
        job.getType(),
        job.getItems(),
        job.getStatusId(),
        status != null ? status.name() : null,
        status != null ? status.displayName() : null,
        DayMonthYearDates.format(job.getNestingDate()),
        DayMonthYearDates.format(job.getMachiningDate()),
        DayMonthYearDates.format(job.getAssemblyDate()),
        DayMonthYearDates.format(job.getDeliveryDate()),
        status != null
            ? StageColumnMapping.activeColumns(status).stream().map(DateColumn::key).toList()
            : List.of(),
        job.getComments(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
