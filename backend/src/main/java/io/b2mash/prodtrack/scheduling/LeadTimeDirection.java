package io.b2mash.prodtrack.scheduling;

import java.util.Locale;

public enum LeadTimeDirection {
  /** The from-status date is N working days earlier than the to-status date. */
  BEFORE,
  AFTER;

  /** Lower-case wire value ({@code before} / {@code after}). */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses the wire value, case-insensitively.
   *
   * @throws IllegalArgumentException for anything other than before/after
   */
  public static LeadTimeDirection fromValue(String value) {
    if (value != null) {
      for (LeadTimeDirection direction : values()) {
        if (direction.name().equalsIgnoreCase(value.trim())) {
          return direction;
        }
      }
    }
    throw new IllegalArgumentException("Direction must be either \"before\" or \"after\"");
  }
}
