package io.b2mash.prodtrack.scheduling.dto;

import io.b2mash.prodtrack.scheduling.DateColumn;
import io.b2mash.prodtrack.scheduling.DayMonthYearDates;
import io.b2mash.prodtrack.scheduling.ScheduledDates;

/** Calculated dates in {@code dd/MM/yyyy}; a null field could not be determined. */
public record CalculatedDatesResponse(
    String nestingDate, String machiningDate, String assemblyDate, String deliveryDate) {

  public static CalculatedDatesResponse from(ScheduledDates dates) {
    return new CalculatedDatesResponse(
        format(dates, DateColumn.NESTING),
        format(dates, DateColumn.MACHINING),
        format(dates, DateColumn.ASSEMBLY),
        format(dates, DateColumn.DELIVERY));
  }

  private static String format(ScheduledDates dates, DateColumn column) {
    return dates.dateFor(column).map(DayMonthYearDates::format).orElse(null);
  }
}
