package io.b2mash.prodtrack.scheduling;

/**
 * Highlighting hint attached to a status: while a job sits in that status, the given date column is
 * rendered in {@code color}.
 */
public record ColumnTarget(String column, String color) {}
