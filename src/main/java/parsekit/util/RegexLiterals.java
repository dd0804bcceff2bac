package parsekit.util;

/**
 * Utility class for turning literal text into regular expressions.
 */
public final class RegexLiterals {

  private RegexLiterals() { }

  /**
   * Escape every metacharacter so the pattern matches the text literally.
   *
   * Each metacharacter gets its own backslash; there is no {@code \Q...\E}
   * quoting.
   *
   * @param literal literal text
   * @return regular expression matching exactly {@code literal}
   */
  public static String escape(String literal) {
    final var builder = new StringBuilder(literal.length() * 2);
    for (int i = 0; i < literal.length(); i++) {
      final char c = literal.charAt(i);
      if (isMetacharacter(c)) {
        builder.append('\\');
      }
      builder.append(c);
    }
    return builder.toString();
  }

  /**
   * Does the character have special meaning outside of a character class?
   *
   * @param c character
   * @return whether the character needs a backslash to be matched literally
   */
  public static boolean isMetacharacter(char c) {
    switch (c) {
      case '\\':
      case '.':
      case '+':
      case '*':
      case '?':
      case '(':
      case ')':
      case '|':
      case '[':
      case ']':
      case '{':
      case '}':
      case '^':
      case '$':
        return true;

      default:
        return false;
    }
  }
}
