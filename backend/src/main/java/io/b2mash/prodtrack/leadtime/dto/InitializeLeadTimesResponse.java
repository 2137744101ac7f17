package io.b2mash.prodtrack.leadtime.dto;

/**
 * @param created rules inserted by this call
 * @param skipped pairs that already had a rule and were left untouched
 */
public record InitializeLeadTimesResponse(String message, int created, int skipped) {}
