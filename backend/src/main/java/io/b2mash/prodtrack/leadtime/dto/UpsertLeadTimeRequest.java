package io.b2mash.prodtrack.leadtime.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record UpsertLeadTimeRequest(
    @NotNull Long fromStatusId,
    @NotNull Long toStatusId,
    @NotNull @Min(0) Integer days,
    String direction,
    Boolean isActive) {}
