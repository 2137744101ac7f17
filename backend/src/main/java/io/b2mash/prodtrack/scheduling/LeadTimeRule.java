package io.b2mash.prodtrack.scheduling;

/** Immutable snapshot of a configured lead time between two statuses. */
public record LeadTimeRule(
    long id,
    long fromStageId,
    long toStageId,
    int days,
    LeadTimeDirection direction,
    boolean active) {}
