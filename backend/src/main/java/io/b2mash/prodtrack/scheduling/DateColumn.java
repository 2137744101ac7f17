package io.b2mash.prodtrack.scheduling;

import java.util.Locale;

/** Date columns a job carries, one per tracked production milestone. */
public enum DateColumn {
  NESTING,
  MACHINING,
  ASSEMBLY,
  DELIVERY;

  /** Column key used in status target columns ({@code nesting}, {@code machining}, ...). */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
