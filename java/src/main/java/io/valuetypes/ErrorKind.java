package io.valuetypes;

/** The type of error raised when a date cannot be built or read. */
public enum ErrorKind {
  /** The (year, month, day) triple does not name a day of the supported calendar. */
  INVALID_DATE("invalid_date"),
  /** The text is not in YYYY-MM-DD form. */
  PARSE("parse");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
