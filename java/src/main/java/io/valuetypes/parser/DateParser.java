package io.valuetypes.parser;

import io.valuetypes.Date;
import io.valuetypes.DateException;
import io.valuetypes.Span;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Reads dates written as {@code YYYY-MM-DD}.
 *
 * <p>The format is fixed: a four-digit year, a two-digit month and a two-digit day, zero-padded
 * and separated by hyphens. Nothing else is accepted, including surrounding whitespace, signs,
 * other separators or other field orders.
 */
public final class DateParser {
  /** Length of the {@code YYYY-MM-DD} form. */
  public static final int LENGTH = 10;

  private static final Span YEAR_SPAN = new Span(0, 4);
  private static final Span MONTH_SPAN = new Span(5, 7);
  private static final Span DAY_SPAN = new Span(8, 10);

  private final String input;
  private int pos;

  private DateParser(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Parses the input into a date.
   *
   * @param input the text to parse
   * @return the parsed date
   * @throws DateException if the text is not in {@code YYYY-MM-DD} form or names a date that does
   *     not exist
   */
  public static Date parse(String input) throws DateException {
    Objects.requireNonNull(input, "input");
    return new DateParser(input).doParse();
  }

  private Date doParse() throws DateException {
    int year = readField(4, "year");
    expectHyphen();
    int month = readField(2, "month");
    expectHyphen();
    int day = readField(2, "day");

    if (pos < input.length()) {
      throw DateException.parse(
          "unexpected trailing input", new Span(pos, input.length()), input);
    }

    if (year < Date.MIN_YEAR || year > Date.MAX_YEAR) {
      throw DateException.invalidDate(
          "year " + input.substring(0, 4) + " is outside the supported range", YEAR_SPAN, input);
    }
    if (month < 1 || month > 12) {
      throw DateException.invalidDate(
          "month " + input.substring(5, 7) + " is outside 01-12", MONTH_SPAN, input);
    }
    int monthLength = YearMonth.of(year, month).lengthOfMonth();
    if (day < 1 || day > monthLength) {
      throw DateException.invalidDate(
          "day " + input.substring(8, 10) + " is outside 01-" + monthLength + " for this month",
          DAY_SPAN,
          input);
    }

    return Date.of(year, month, day);
  }

  private int readField(int width, String name) throws DateException {
    int value = 0;
    for (int i = 0; i < width; i++) {
      if (pos >= input.length()) {
        throw DateException.parse(
            "unexpected end of input, expected " + width + "-digit " + name, Span.at(pos), input);
      }
      char ch = input.charAt(pos);
      if (!isDigit(ch)) {
        throw DateException.parse(
            "expected digit in " + name + ", found '" + ch + "'", Span.at(pos), input);
      }
      value = value * 10 + (ch - '0');
      pos++;
    }
    return value;
  }

  private void expectHyphen() throws DateException {
    if (pos >= input.length()) {
      throw DateException.parse("unexpected end of input, expected '-'", Span.at(pos), input);
    }
    char ch = input.charAt(pos);
    if (ch != '-') {
      throw DateException.parse(
          "expected '-' at position " + pos + ", found '" + ch + "'", Span.at(pos), input);
    }
    pos++;
  }

  // ASCII only; Character.isDigit would admit other scripts' digits.
  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }
}
