package io.valuetypes;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week, ordered from Sunday to Saturday. */
public enum Weekday {
  SUNDAY(7, "sunday"),
  MONDAY(1, "monday"),
  TUESDAY(2, "tuesday"),
  WEDNESDAY(3, "wednesday"),
  THURSDAY(4, "thursday"),
  FRIDAY(5, "friday"),
  SATURDAY(6, "saturday");

  private final int isoNumber;
  private final String displayName;

  Weekday(int isoNumber, String displayName) {
    this.isoNumber = isoNumber;
    this.displayName = displayName;
  }

  /**
   * Returns the day number counted from Sunday (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the day number
   */
  public int number() {
    return ordinal();
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int isoNumber() {
    return isoNumber;
  }

  /**
   * Returns whether this day falls on a weekend (Saturday or Sunday).
   *
   * @return true for Saturday and Sunday
   */
  public boolean isWeekend() {
    return this == SATURDAY || this == SUNDAY;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("sunday", SUNDAY), Map.entry("sun", SUNDAY),
          Map.entry("monday", MONDAY), Map.entry("mon", MONDAY),
          Map.entry("tuesday", TUESDAY), Map.entry("tue", TUESDAY),
          Map.entry("wednesday", WEDNESDAY), Map.entry("wed", WEDNESDAY),
          Map.entry("thursday", THURSDAY), Map.entry("thu", THURSDAY),
          Map.entry("friday", FRIDAY), Map.entry("fri", FRIDAY),
          Map.entry("saturday", SATURDAY), Map.entry("sat", SATURDAY));

  /**
   * Parses a weekday name (case insensitive), full or three-letter.
   *
   * @param s the string to parse, may be null
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns a Weekday from a day number counted from Sunday.
   *
   * @param n the day number (0-6)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 0 || n > 6) {
      return Optional.empty();
    }
    return Optional.of(values()[n]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(java.time.DayOfWeek dow) {
    return values()[dow.getValue() % 7];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public java.time.DayOfWeek toDayOfWeek() {
    return java.time.DayOfWeek.of(isoNumber);
  }
}
