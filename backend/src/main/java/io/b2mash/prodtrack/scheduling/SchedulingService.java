package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.scheduling.dto.AdvanceStatusRequest;
import io.b2mash.prodtrack.scheduling.dto.AdvanceStatusResponse;
import io.b2mash.prodtrack.scheduling.dto.CalculateDatesRequest;
import io.b2mash.prodtrack.scheduling.dto.CalculatedDatesResponse;
import java.time.LocalDate;
import java.util.EnumMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/** Entry point to the scheduling engine for the rest of the application. */
@Service
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingService {

  private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

  private final SchedulingSnapshotLoader snapshotLoader;
  private final SchedulingProperties properties;

  public SchedulingService(
      SchedulingSnapshotLoader snapshotLoader, SchedulingProperties properties) {
    this.snapshotLoader = snapshotLoader;
    this.properties = properties;
  }

  public ScheduledDates scheduleFromDelivery(LocalDate deliveryDate) {
    return scheduleFromDelivery(snapshotLoader.load(), deliveryDate);
  }

  /**
   * Computes nesting, machining and assembly dates for the given delivery date against one
   * snapshot. Columns whose status is not configured, or that have no lead time chain back to
   * delivery, are left out.
   */
  public ScheduledDates scheduleFromDelivery(SchedulingSnapshot snapshot, LocalDate deliveryDate) {
    var mapping = StageColumnMapping.of(snapshot.pipeline(), properties.stageColumns());
    var anchor = mapping.anchorStage();
    var upstream = mapping.upstreamStages();

    var result =
        snapshot
            .scheduler()
            .computeUpstreamDates(
                anchor.id(), deliveryDate, upstream.values().stream().map(Stage::id).toList());

    var dates = new EnumMap<DateColumn, LocalDate>(DateColumn.class);
    upstream.forEach(
        (column, stage) -> result.dateFor(stage.id()).ifPresent(date -> dates.put(column, date)));

    log.debug(
        "Scheduled from delivery: deliveryDate={}, resolved={}, unresolved={}",
        deliveryDate,
        dates.keySet(),
        result.unresolvedStageIds());
    return new ScheduledDates(deliveryDate, dates);
  }

  public CalculatedDatesResponse calculate(CalculateDatesRequest request) {
    LocalDate deliveryDate =
        DayMonthYearDates.parseRequired(request.deliveryDate(), "deliveryDate");
    return CalculatedDatesResponse.from(scheduleFromDelivery(deliveryDate));
  }

  public Stage nextStage(long currentStageId) {
    return StatusCycler.advance(snapshotLoader.loadPipeline(), currentStageId);
  }

  public AdvanceStatusResponse advance(AdvanceStatusRequest request) {
    return AdvanceStatusResponse.from(nextStage(request.currentStageId()));
  }
}
