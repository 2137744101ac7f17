package io.b2mash.prodtrack.job.dto;

import jakarta.validation.constraints.NotBlank;

public record RescheduleJobRequest(@NotBlank String deliveryDate) {}
