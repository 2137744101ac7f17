package io.b2mash.prodtrack.leadtime.dto;

import io.b2mash.prodtrack.leadtime.LeadTime;
import java.time.Instant;

public record LeadTimeResponse(
    Long id,
    Long fromStatusId,
    Long toStatusId,
    int days,
    String direction,
    boolean isActive,
    Instant createdAt,
    Instant updatedAt) {

  public static LeadTimeResponse from(LeadTime leadTime) {
    return new LeadTimeResponse(
        leadTime.getId(),
        leadTime.getFromStatusId(),
        leadTime.getToStatusId(),
        leadTime.getDays(),
        leadTime.getDirection().value(),
        leadTime.isActive(),
        leadTime.getCreatedAt(),
        leadTime.getUpdatedAt());
  }
}
