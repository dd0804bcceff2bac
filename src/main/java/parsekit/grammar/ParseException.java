package parsekit.grammar;

import java.util.List;

/**
 * Details about malformed input, handed to error-recovery reductions.
 *
 * @see Production#setErrorFunction
 */
public class ParseException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = -6043829971251349617L;

  /**
   * Text of the token that could not be handled ({@code null} at end of input).
   */
  public final String foundLexeme;

  /**
   * Debug names of the tokens that would have been accepted instead.
   */
  public final List<String> expectedTokens;

  /**
   * 1-based line of the offending token.
   */
  public final int line;

  /**
   * 1-based column of the offending token.
   */
  public final int column;

  public ParseException(
    String message,
    String foundLexeme,
    List<String> expectedTokens,
    int line,
    int column
  ) {
    super(message);
    this.foundLexeme = foundLexeme;
    this.expectedTokens = List.copyOf(expectedTokens);
    this.line = line;
    this.column = column;
  }
}
