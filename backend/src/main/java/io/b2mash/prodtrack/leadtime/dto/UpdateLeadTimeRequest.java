package io.b2mash.prodtrack.leadtime.dto;

import jakarta.validation.constraints.Min;

/** Partial update; null fields keep their current value. */
public record UpdateLeadTimeRequest(@Min(0) Integer days, String direction, Boolean isActive) {}
