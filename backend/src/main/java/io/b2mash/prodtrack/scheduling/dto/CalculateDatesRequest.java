package io.b2mash.prodtrack.scheduling.dto;

import jakarta.validation.constraints.NotBlank;

/** Delivery date in {@code dd/MM/yyyy}. */
public record CalculateDatesRequest(@NotBlank String deliveryDate) {}
