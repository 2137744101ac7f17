package io.b2mash.prodtrack.scheduling;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one backward scheduling pass. Resolved dates are keyed by stage id in resolution order
 * (nearest to the anchor first); stages without an applicable lead time appear only in {@link
 * #unresolvedStageIds()} and have no date.
 */
public record ScheduleResult(Map<Long, LocalDate> dates, List<Long> unresolvedStageIds) {

  public ScheduleResult {
    dates = Collections.unmodifiableMap(new LinkedHashMap<>(dates));
    unresolvedStageIds = List.copyOf(unresolvedStageIds);
  }

  public Optional<LocalDate> dateFor(long stageId) {
    return Optional.ofNullable(dates.get(stageId));
  }
}
