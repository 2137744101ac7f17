package io.b2mash.prodtrack.jobstatus.dto;

import io.b2mash.prodtrack.scheduling.ColumnTarget;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateJobStatusRequest(
    @NotBlank @Size(max = 100) String name,
    @NotBlank @Size(max = 100) String displayName,
    @NotBlank @Pattern(regexp = "^#[0-9A-Fa-f]{6}$") String color,
    @NotBlank @Pattern(regexp = "^#[0-9A-Fa-f]{6}$") String backgroundColor,
    Integer orderIndex,
    Boolean isDefault,
    Boolean isFinal,
    List<ColumnTarget> targetColumns) {}
