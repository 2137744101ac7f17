package io.b2mash.prodtrack.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Business calendar used by the scheduler. A working day is any Monday to Friday that is not a
 * registered holiday. Instances are immutable and safe to share between threads.
 */
public final class WorkingCalendar {

  private final Set<LocalDate> holidays;

  private WorkingCalendar(Set<LocalDate> holidays) {
    this.holidays = Set.copyOf(holidays);
  }

  public static WorkingCalendar weekendsOnly() {
    return new WorkingCalendar(Set.of());
  }

  public static WorkingCalendar ofDates(Collection<LocalDate> holidayDates) {
    return new WorkingCalendar(
        holidayDates.stream().filter(Objects::nonNull).collect(Collectors.toSet()));
  }

  public static WorkingCalendar of(Collection<Holiday> holidays) {
    return ofDates(holidays.stream().map(Holiday::getDate).toList());
  }

  public boolean isWorkingDay(LocalDate date) {
    DayOfWeek dayOfWeek = date.getDayOfWeek();
    if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
      return false;
    }
    return !holidays.contains(date);
  }

  /**
   * Walks backward from {@code date} one calendar day at a time and returns the day on which the
   * {@code workingDays}-th working day is reached. Zero returns {@code date} unchanged.
   *
   * @throws IllegalArgumentException if {@code workingDays} is negative
   */
  public LocalDate subtractWorkingDays(LocalDate date, int workingDays) {
    Objects.requireNonNull(date, "date must not be null");
    if (workingDays < 0) {
      throw new IllegalArgumentException("workingDays must be >= 0, got: " + workingDays);
    }
    LocalDate result = date;
    int remaining = workingDays;
    while (remaining > 0) {
      result = result.minusDays(1);
      if (isWorkingDay(result)) {
        remaining--;
      }
    }
    return result;
  }

  /** Returns {@code date} if it is a working day, otherwise the closest earlier working day. */
  public LocalDate onOrBefore(LocalDate date) {
    LocalDate result = date;
    while (!isWorkingDay(result)) {
      result = result.minusDays(1);
    }
    return result;
  }
}
