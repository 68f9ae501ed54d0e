package io.valuetypes;

import java.util.Locale;

/**
 * The (year, month, day) fields of a {@link Date}.
 *
 * <p>A DateParts is only a triple of integers and is not validated on its own; {@link #toDate()}
 * applies the calendar rules.
 *
 * @param year the year
 * @param month the month (1-12)
 * @param day the day of month (1-31)
 */
public record DateParts(int year, int month, int day) {
  /**
   * Builds the date these fields name.
   *
   * @return the date
   * @throws DateException if the fields do not name a valid date
   */
  public Date toDate() throws DateException {
    return Date.of(year, month, day);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%04d-%02d-%02d", year, month, day);
  }
}
