package parsekit.lexer;

import java.util.List;

/**
 * Options for the lexer generated alongside a grammar.
 *
 * @param escapeLiterals whether literal strings in productions get their
 *                       regular expression metacharacters escaped
 * @param ignore patterns the lexer matches and then skips (whitespace,
 *               comments, etc.)
 */
public record LexerSettings(
  boolean escapeLiterals,
  List<String> ignore
) {

  public LexerSettings {
    ignore = List.copyOf(ignore);
  }

  /**
   * Literals are escaped and nothing is ignored.
   */
  public static LexerSettings defaults() {
    return new LexerSettings(true, List.of());
  }

  public LexerSettings withEscapeLiterals(boolean escape) {
    return new LexerSettings(escape, ignore);
  }

  public LexerSettings withIgnore(String... patterns) {
    return new LexerSettings(escapeLiterals, List.of(patterns));
  }
}
