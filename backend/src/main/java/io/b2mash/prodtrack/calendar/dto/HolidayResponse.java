package io.b2mash.prodtrack.calendar.dto;

import io.b2mash.prodtrack.calendar.Holiday;
import java.time.Instant;
import java.time.LocalDate;

public record HolidayResponse(
    Long id,
    String name,
    LocalDate date,
    boolean isPublic,
    boolean isCustom,
    String description,
    Instant createdAt,
    Instant updatedAt) {

  public static HolidayResponse from(Holiday holiday) {
    return new HolidayResponse(
        holiday.getId(),
        holiday.getName(),
        holiday.getDate(),
        holiday.isPublic(),
        holiday.isCustom(),
        holiday.getDescription(),
        holiday.getCreatedAt(),
        holiday.getUpdatedAt());
  }
}
