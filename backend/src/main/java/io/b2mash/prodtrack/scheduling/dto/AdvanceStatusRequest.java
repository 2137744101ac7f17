package io.b2mash.prodtrack.scheduling.dto;

import jakarta.validation.constraints.NotNull;

public record AdvanceStatusRequest(@NotNull Long currentStageId) {}
