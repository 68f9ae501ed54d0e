package io.valuetypes;

import java.util.Optional;

/** Exception thrown when a date cannot be constructed or parsed. */
public final class DateException extends Exception {
  private static final long serialVersionUID = 1L;

  /** The error kind. */
  private final ErrorKind kind;

  /** The input span the error points at, if the error came from text. */
  private final Span span;

  /** The original input string. */
  private final String input;

  private DateException(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates an error for a (year, month, day) triple that is not a valid date.
   *
   * @param message the error message
   * @return a new DateException of kind INVALID_DATE
   */
  public static DateException invalidDate(String message) {
    return new DateException(ErrorKind.INVALID_DATE, message, null, null);
  }

  /**
   * Creates an error for well-formed text naming a date that does not exist.
   *
   * @param message the error message
   * @param span the location of the offending field in the input
   * @param input the original input string
   * @return a new DateException of kind INVALID_DATE
   */
  public static DateException invalidDate(String message, Span span, String input) {
    return new DateException(ErrorKind.INVALID_DATE, message, span, input);
  }

  /**
   * Creates a parser error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @return a new DateException of kind PARSE
   */
  public static DateException parse(String message, Span span, String input) {
    return new DateException(ErrorKind.PARSE, message, span, input);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message that underlines the offending characters.
   *
   * <p>For errors carrying a span and input, produces output like:
   *
   * <pre>
   * error: expected '-' at position 4
   *   2010/01/01
   *       ^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
