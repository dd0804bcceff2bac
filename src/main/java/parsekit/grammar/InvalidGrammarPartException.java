package parsekit.grammar;

/**
 * A production part was neither a literal string nor a symbol.
 *
 * Thrown before the production is recorded, so the non-terminal is left
 * unchanged.
 */
public class InvalidGrammarPartException extends GrammarConfigurationException {

  @java.io.Serial
  private static final long serialVersionUID = -2716203359172284407L;

  /**
   * Offending part (may be {@code null}).
   */
  public final transient Object part;

  /**
   * Position of the offending part in the production.
   */
  public final int index;

  public InvalidGrammarPartException(Object part, int index) {
    super(
      "Production part " + index + " must be a String or a Symbol, but was " +
      (part == null ? "null" : part.getClass().getName())
    );
    this.part = part;
    this.index = index;
  }
}
