package io.b2mash.prodtrack.calendar.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

public record HolidayRequest(
    @NotBlank @Size(max = 255) String name,
    @NotNull LocalDate date,
    Boolean isPublic,
    Boolean isCustom,
    String description) {}
