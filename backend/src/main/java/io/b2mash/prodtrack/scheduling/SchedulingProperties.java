package io.b2mash.prodtrack.scheduling;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scheduling configuration.
 *
 * @param stageColumns job status name to the job date column that status fills in; each column may
 *     be named by one status only
 * @param defaultDaysPerStage working days per pipeline step used when seeding default lead times
 */
@ConfigurationProperties(prefix = "prodtrack.scheduling")
public record SchedulingProperties(Map<String, DateColumn> stageColumns, int defaultDaysPerStage) {

  public static final Map<String, DateColumn> DEFAULT_STAGE_COLUMNS =
      Map.of(
          "nesting", DateColumn.NESTING,
          "machining", DateColumn.MACHINING,
          "assembly", DateColumn.ASSEMBLY,
          "delivery", DateColumn.DELIVERY);

  public SchedulingProperties {
    stageColumns =
        stageColumns == null || stageColumns.isEmpty()
            ? DEFAULT_STAGE_COLUMNS
            : Collections.unmodifiableMap(new LinkedHashMap<>(stageColumns));
    var namesByColumn = new EnumMap<DateColumn, String>(DateColumn.class);
    stageColumns.forEach(
        (stageName, column) -> {
          String previous = namesByColumn.putIfAbsent(column, stageName);
          if (previous != null) {
            throw new IllegalArgumentException(
                "Date column "
                    + column
                    + " is mapped to both '"
                    + previous
                    + "' and '"
                    + stageName
                    + "'");
          }
        });
    if (defaultDaysPerStage <= 0) {
      defaultDaysPerStage = 2;
    }
  }

  public static SchedulingProperties defaults() {
    return new SchedulingProperties(null, 0);
  }
}
