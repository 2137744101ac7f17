package io.b2mash.prodtrack.scheduling;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** Job dates derived from a delivery date. Columns that could not be resolved are absent. */
public record ScheduledDates(LocalDate deliveryDate, Map<DateColumn, LocalDate> upstream) {

  public ScheduledDates {
    var copy = new EnumMap<DateColumn, LocalDate>(DateColumn.class);
    copy.putAll(upstream);
    upstream = Collections.unmodifiableMap(copy);
  }

  public Optional<LocalDate> dateFor(DateColumn column) {
    if (column == DateColumn.DELIVERY) {
      return Optional.ofNullable(deliveryDate);
    }
    return Optional.ofNullable(upstream.get(column));
  }
}
