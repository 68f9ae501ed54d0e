package io.valuetypes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.valuetypes.parser.DateParser;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A calendar date without a time of day or time zone.
 *
 * <p>Dates follow the proleptic Gregorian calendar and cover the years {@value #MIN_YEAR} to
 * {@value #MAX_YEAR}. Values are immutable; arithmetic returns a new date. The text form is
 * always {@code YYYY-MM-DD}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Date start = Date.of(2024, 1, 31);
 * Date end = start.plusMonths(1);          // 2024-02-29
 * Optional<Date> parsed = Date.tryParse("2024-02-29");
 * }</pre>
 */
public final class Date implements Comparable<Date>, Serializable {
  private static final long serialVersionUID = 1L;

  /** The earliest supported year. */
  public static final int MIN_YEAR = 1;

  /** The latest supported year. */
  public static final int MAX_YEAR = 9999;

  /** The earliest supported date, 0001-01-01. */
  public static final Date MIN = new Date(LocalDate.of(MIN_YEAR, 1, 1));

  /** The latest supported date, 9999-12-31. */
  public static final Date MAX = new Date(LocalDate.of(MAX_YEAR, 12, 31));

  private final LocalDate value;

  private Date(LocalDate value) {
    this.value = value;
  }

  /**
   * Creates a date from its year, month and day.
   *
   * @param year the year ({@value #MIN_YEAR}-{@value #MAX_YEAR})
   * @param month the month (1-12)
   * @param day the day of month, valid for the year and month
   * @return the date
   * @throws DateException if the fields do not name a valid date
   */
  public static Date of(int year, int month, int day) throws DateException {
    if (year < MIN_YEAR || year > MAX_YEAR) {
      throw DateException.invalidDate(
          "year " + year + " is outside the supported range " + MIN_YEAR + "-" + MAX_YEAR);
    }
    if (month < 1 || month > 12) {
      throw DateException.invalidDate("month " + month + " is outside 1-12");
    }
    int monthLength = YearMonth.of(year, month).lengthOfMonth();
    if (day < 1 || day > monthLength) {
      throw DateException.invalidDate(
          String.format(
              Locale.ROOT,
              "day %d is outside 1-%d for %04d-%02d", day, monthLength, year, month));
    }
    return new Date(LocalDate.of(year, month, day));
  }

  /**
   * Creates a date from a {@link LocalDate}.
   *
   * @param date the local date
   * @return the date
   * @throws DateException if the year is outside the supported range
   */
  public static Date from(LocalDate date) throws DateException {
    Objects.requireNonNull(date, "date");
    return of(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
  }

  /**
   * Returns the current date in the system default time zone.
   *
   * @return today's date
   */
  public static Date today() {
    return today(Clock.systemDefaultZone());
  }

  /**
   * Returns the current date in the given time zone.
   *
   * @param zone the zone whose calendar day is wanted
   * @return today's date in that zone
   */
  public static Date today(ZoneId zone) {
    return today(Clock.system(zone));
  }

  /**
   * Returns the current date as read from the given clock.
   *
   * @param clock the clock to read
   * @return today's date according to the clock
   */
  public static Date today(Clock clock) {
    return checked(LocalDate.now(clock));
  }

  /**
   * Parses a date in {@code YYYY-MM-DD} form.
   *
   * @param text the text to parse
   * @return the parsed date
   * @throws DateException if the text is malformed or names a date that does not exist
   */
  public static Date parse(String text) throws DateException {
    return DateParser.parse(text);
  }

  /**
   * Parses a date in {@code YYYY-MM-DD} form without throwing.
   *
   * @param text the text to parse, may be null
   * @return the parsed date, or empty if the text is not a valid date
   */
  public static Optional<Date> tryParse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(DateParser.parse(text));
    } catch (DateException e) {
      return Optional.empty();
    }
  }

  /**
   * Checks whether the text is a valid date in {@code YYYY-MM-DD} form.
   *
   * @param text the text to check, may be null
   * @return true if {@link #tryParse(String)} would succeed
   */
  public static boolean validate(String text) {
    return tryParse(text).isPresent();
  }

  /**
   * Reads a date from its JSON string form.
   *
   * @param text the {@code YYYY-MM-DD} string
   * @return the parsed date
   * @throws IllegalArgumentException if the text is not a valid date
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Date fromJson(String text) {
    try {
      return DateParser.parse(text);
    } catch (DateException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }
  }

  /**
   * Returns the year.
   *
   * @return the year ({@value #MIN_YEAR}-{@value #MAX_YEAR})
   */
  public int year() {
    return value.getYear();
  }

  /**
   * Returns the month.
   *
   * @return the month (1-12)
   */
  public int month() {
    return value.getMonthValue();
  }

  /**
   * Returns the day of month.
   *
   * @return the day of month (1-31)
   */
  public int day() {
    return value.getDayOfMonth();
  }

  /**
   * Returns the day of the week.
   *
   * @return the weekday
   */
  public Weekday dayOfWeek() {
    return Weekday.fromDayOfWeek(value.getDayOfWeek());
  }

  /**
   * Returns the day of the year, 1 for January 1st.
   *
   * @return the day of year (1-366)
   */
  public int dayOfYear() {
    return value.getDayOfYear();
  }

  /**
   * Returns whether this date's year is a leap year.
   *
   * @return true for leap years
   */
  public boolean isLeapYear() {
    return value.isLeapYear();
  }

  /**
   * Returns the number of days in this date's month.
   *
   * @return the month length (28-31)
   */
  public int lengthOfMonth() {
    return value.lengthOfMonth();
  }

  /**
   * Returns the number of days in this date's year.
   *
   * @return 365 or 366
   */
  public int lengthOfYear() {
    return value.lengthOfYear();
  }

  /**
   * Returns the year, month and day of this date.
   *
   * @return the date's fields
   */
  public DateParts decompose() {
    return new DateParts(year(), month(), day());
  }

  /**
   * Returns a copy of this date with the given number of days added.
   *
   * @param days the days to add, may be negative
   * @return the shifted date
   * @throws DateTimeException if the result is outside the supported range
   */
  public Date plusDays(long days) {
    try {
      return checked(value.plusDays(days));
    } catch (ArithmeticException e) {
      throw outOfRange(e);
    }
  }

  /**
   * Returns a copy of this date with the given number of months added.
   *
   * <p>If the day of month does not exist in the resulting month, it is clamped to the last day
   * of that month, so 2001-01-31 plus one month is 2001-02-28.
   *
   * @param months the months to add, may be negative
   * @return the shifted date
   * @throws DateTimeException if the result is outside the supported range
   */
  public Date plusMonths(long months) {
    return checked(value.plusMonths(months));
  }

  /**
   * Returns a copy of this date with the given number of years added.
   *
   * <p>February 29th becomes February 28th when the resulting year is not a leap year.
   *
   * @param years the years to add, may be negative
   * @return the shifted date
   * @throws DateTimeException if the result is outside the supported range
   */
  public Date plusYears(long years) {
    return checked(value.plusYears(years));
  }

  /**
   * Returns a copy of this date with the given number of days subtracted.
   *
   * @param days the days to subtract, may be negative
   * @return the shifted date
   * @throws DateTimeException if the result is outside the supported range
   */
  public Date minusDays(long days) {
    try {
      return checked(value.minusDays(days));
    } catch (ArithmeticException e) {
      throw outOfRange(e);
    }
  }

  /**
   * Returns a copy of this date with the given number of months subtracted, clamping the day of
   * month like {@link #plusMonths(long)}.
   *
   * @param months the months to subtract, may be negative
   * @return the shifted date
   * @throws DateTimeException if the result is outside the supported range
   */
  public Date minusMonths(long months) {
    return checked(value.minusMonths(months));
  }

  /**
   * Returns a copy of this date with the given number of years subtracted, clamping February
   * 29th like {@link #plusYears(long)}.
   *
   * @param years the years to subtract, may be negative
   * @return the shifted date
   * @throws DateTimeException if the result is outside the supported range
   */
  public Date minusYears(long years) {
    return checked(value.minusYears(years));
  }

  /**
   * Returns the number of days from this date to another.
   *
   * @param other the end date
   * @return the day count, negative if {@code other} is earlier
   */
  public long daysUntil(Date other) {
    return ChronoUnit.DAYS.between(value, other.value);
  }

  /**
   * Checks if this date is before the given date.
   *
   * @param other the date to compare to
   * @return true if this date is strictly earlier
   */
  public boolean isBefore(Date other) {
    return value.isBefore(other.value);
  }

  /**
   * Checks if this date is after the given date.
   *
   * @param other the date to compare to
   * @return true if this date is strictly later
   */
  public boolean isAfter(Date other) {
    return value.isAfter(other.value);
  }

  /**
   * Checks if this date is the same day as the given date.
   *
   * @param other the date to compare to
   * @return true if both name the same day
   */
  public boolean isEqual(Date other) {
    return value.isEqual(other.value);
  }

  /**
   * Converts this date to a {@link LocalDate}.
   *
   * @return the equivalent local date
   */
  public LocalDate toLocalDate() {
    return value;
  }

  @Override
  public int compareTo(Date other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Date other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  /**
   * Returns this date in {@code YYYY-MM-DD} form.
   *
   * @return the ISO 8601 calendar date
   */
  @JsonValue
  @Override
  public String toString() {
    return String.format(Locale.ROOT, "%04d-%02d-%02d", year(), month(), day());
  }

  private static Date checked(LocalDate date) {
    int year = date.getYear();
    if (year < MIN_YEAR || year > MAX_YEAR) {
      throw new DateTimeException("date " + date + " is outside the supported range");
    }
    return new Date(date);
  }

  // Day counts far past the supported range overflow the epoch-day long before LocalDate checks it.
  private static DateTimeException outOfRange(ArithmeticException cause) {
    return new DateTimeException("date arithmetic is outside the supported range", cause);
  }

  // Serialization goes through SerializedForm so a stream can never produce an invalid Date.

  private Object writeReplace() {
    return new SerializedForm(year(), month(), day());
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("Date must be deserialized through its serialized form");
  }

  private record SerializedForm(int year, int month, int day) implements Serializable {
    private Object readResolve() throws ObjectStreamException {
      try {
        return Date.of(year, month, day);
      } catch (DateException e) {
        InvalidObjectException ex = new InvalidObjectException(e.getMessage());
        ex.initCause(e);
        throw ex;
      }
    }
  }
}
