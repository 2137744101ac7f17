package io.b2mash.prodtrack.jobstatus.dto;

import io.b2mash.prodtrack.scheduling.ColumnTarget;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

/** Partial update; null fields keep their current value. */
public record UpdateJobStatusRequest(
    @Size(max = 100) String name,
    @Size(max = 100) String displayName,
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$") String color,
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$") String backgroundColor,
    Integer orderIndex,
    Boolean isDefault,
    Boolean isFinal,
    List<ColumnTarget> targetColumns) {}
