package parsekit.lexer;

/**
 * Inclusive (and therefore non-empty) range of characters.
 *
 * Bounds given in the wrong order get swapped, so {@code from <= to} always
 * holds. Ranges are values: anything that widens or narrows a range makes a
 * new one and replaces the old one in its owning {@link CharSet}.
 *
 * @param from smallest character in the range
 * @param to largest character in the range
 */
public record CharRange(
  char from,
  char to
) implements Comparable<CharRange> {

  /**
   * Make a range (equivalent to the constructor, but more informatively named).
   *
   * @param from one bound of the range
   * @param to the other bound of the range
   */
  public static CharRange between(char from, char to) {
    return new CharRange(from, to);
  }

  /**
   * Make a range containing only a single character.
   *
   * @param character character in the range
   */
  public static CharRange single(char character) {
    return new CharRange(character, character);
  }

  public CharRange {
    if (from > to) {
      final char swap = to;
      to = from;
      from = swap;
    }
  }

  /**
   * Does this range contain the character?
   *
   * @param character character
   * @return whether the character is in this range
   */
  public boolean contains(char character) {
    return from <= character && character <= to;
  }

  /**
   * Does this range share at least one character with another range?
   *
   * @param other other range ({@code null} gets treated as an empty range)
   * @return whether the ranges overlap
   */
  public boolean overlapsWith(CharRange other) {
    return other != null && from <= other.to && other.from <= to;
  }

  CharRange withFrom(char newFrom) {
    return new CharRange(newFrom, to);
  }

  CharRange withTo(char newTo) {
    return new CharRange(from, newTo);
  }

  @Override
  public int compareTo(CharRange other) {
    final int fromCompare = Character.compare(from, other.from);
    return fromCompare != 0 ? fromCompare : Character.compare(to, other.to);
  }

  /**
   * Display form: {@code a-z}, or just {@code a} for a single character.
   */
  @Override
  public String toString() {
    return (from == to) ? display(from) : display(from) + "-" + display(to);
  }

  private static String display(char character) {
    if (Character.isISOControl(character) ||
        Character.isWhitespace(character) ||
        Character.isSurrogate(character) ||
        !Character.isDefined(character)) {
      return String.format("\\u%04X", (int) character);
    }
    return String.valueOf(character);
  }
}
