package io.b2mash.prodtrack.scheduling;

import io.b2mash.prodtrack.exception.InvalidScheduleInputException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/** Parsing and formatting of the {@code dd/MM/yyyy} dates exchanged with clients. */
public final class DayMonthYearDates {

  public static final String PATTERN = "dd/MM/uuuu";

  private static final DateTimeFormatter FORMATTER =
      DateTimeFormatter.ofPattern(PATTERN).withResolverStyle(ResolverStyle.STRICT);

  // Day and month may omit the leading zero on input; the year must have four digits.
  private static final DateTimeFormatter PARSER =
      DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT);

  private DayMonthYearDates() {}

  /**
   * Parses a {@code dd/MM/yyyy} value. Null or blank input yields empty.
   *
   * @throws InvalidScheduleInputException if the value is not a real calendar date in that form
   */
  public static Optional<LocalDate> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.parse(value.trim(), PARSER));
    } catch (DateTimeParseException e) {
      throw new InvalidScheduleInputException(
          "Invalid date '" + value + "'. Please use DD/MM/YYYY.");
    }
  }

  /** Like {@link #parse(String)} but rejects missing values. */
  public static LocalDate parseRequired(String value, String field) {
    return parse(value)
        .orElseThrow(() -> new InvalidScheduleInputException(field + " is required (DD/MM/YYYY)"));
  }

  public static String format(LocalDate date) {
    return date == null ? null : FORMATTER.format(date);
  }
}
