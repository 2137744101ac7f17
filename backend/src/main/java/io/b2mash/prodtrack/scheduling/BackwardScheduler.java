package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.calendar.WorkingCalendar;
import io.b2mash.prodtrack.exception.InvalidScheduleInputException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes upstream production dates by walking backward from an anchor (normally the delivery
 * date) across the working calendar.
 *
 * <p>Targets are handled from the one closest to the anchor to the farthest upstream. Each target
 * is resolved against the nearest stage already resolved downstream of it, so that nesting follows
 * machining, machining follows assembly, and assembly follows delivery. When no rule links a target
 * to that stage, the rule to the anchor itself is tried. A target with neither rule stays
 * unresolved.
 *
 * <p>Every computed date is a working day and never later than the date it was derived from. The
 * anchor date is taken as given, even when it falls on a weekend or holiday.
 */
public final class BackwardScheduler {

  private static final Logger log = LoggerFactory.getLogger(BackwardScheduler.class);

  private final StatusPipeline pipeline;
  private final LeadTimeRegistry leadTimes;
  private final WorkingCalendar calendar;

  public BackwardScheduler(
      StatusPipeline pipeline, LeadTimeRegistry leadTimes, WorkingCalendar calendar) {
    this.pipeline = Objects.requireNonNull(pipeline);
    this.leadTimes = Objects.requireNonNull(leadTimes);
    this.calendar = Objects.requireNonNull(calendar);
  }

  /**
   * @param anchorStageId status whose date is known
   * @param anchorDate the known date, used as is
   * @param targetStageIds statuses to compute; the anchor itself is ignored if listed
   * @throws InvalidScheduleInputException if the anchor or a target is not in the pipeline
   */
  public ScheduleResult computeUpstreamDates(
      long anchorStageId, LocalDate anchorDate, Collection<Long> targetStageIds) {
    if (anchorDate == null) {
      throw new InvalidScheduleInputException("Anchor date is required");
    }
    Stage anchor =
        pipeline
            .findById(anchorStageId)
            .orElseThrow(() -> InvalidScheduleInputException.unknownStage(anchorStageId));

    List<Stage> targets =
        targetStageIds.stream()
            .distinct()
            .map(
                id ->
                    pipeline
                        .findById(id)
                        .orElseThrow(() -> InvalidScheduleInputException.unknownStage(id)))
            .filter(stage -> stage.id() != anchor.id())
            .sorted(Comparator.comparingInt(Stage::orderIndex).reversed())
            .toList();

    var resolved = new LinkedHashMap<Long, LocalDate>();
    var unresolved = new ArrayList<Long>();
    long referenceStageId = anchor.id();
    LocalDate referenceDate = anchorDate;

    for (Stage target : targets) {
      Optional<LocalDate> date = resolve(target, referenceStageId, referenceDate);
      if (date.isEmpty() && referenceStageId != anchor.id()) {
        date = resolve(target, anchor.id(), anchorDate);
      }

      if (date.isPresent()) {
        resolved.put(target.id(), date.get());
        referenceStageId = target.id();
        referenceDate = date.get();
      } else {
        log.debug(
            "No lead time chain for status: status={}, anchor={}", target.name(), anchor.name());
        unresolved.add(target.id());
      }
    }

    return new ScheduleResult(resolved, unresolved);
  }

  private Optional<LocalDate> resolve(
      Stage target, long referenceStageId, LocalDate referenceDate) {
    return leadTimes
        .rule(target.id(), referenceStageId)
        .map(
            rule ->
                rule.days() > 0
                    ? calendar.subtractWorkingDays(referenceDate, rule.days())
                    : calendar.onOrBefore(referenceDate));
  }
}
