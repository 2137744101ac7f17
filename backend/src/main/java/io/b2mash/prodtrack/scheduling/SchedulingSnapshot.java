package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.calendar.WorkingCalendar;

/**
 * Consistent, immutable view of statuses, lead times and holidays taken at the start of one
 * scheduling call. Nothing in the snapshot is re-read while it is in use.
 */
public record SchedulingSnapshot(
    StatusPipeline pipeline, LeadTimeRegistry leadTimes, WorkingCalendar calendar) {

  public BackwardScheduler scheduler() {
    return new BackwardScheduler(pipeline, leadTimes, calendar);
  }
}
