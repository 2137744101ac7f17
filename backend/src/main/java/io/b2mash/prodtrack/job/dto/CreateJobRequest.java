package io.b2mash.prodtrack.job.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** {@code deliveryDate} is optional and uses {@code dd/MM/yyyy}. */
public record CreateJobRequest(
    @NotNull Long projectId,
    @Size(max = 100) String unit,
    @Size(max = 100) String type,
    @NotBlank String items,
    String deliveryDate,
    String comments) {}
