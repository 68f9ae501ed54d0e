package io.valuetypes;

/**
 * Represents a range of character positions in parser input.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span.
   *
   * @return the number of characters covered by this span, at least one
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Creates a span covering a single character.
   *
   * @param pos the character position
   * @return a span of length one
   */
  public static Span at(int pos) {
    return new Span(pos, pos + 1);
  }
}
