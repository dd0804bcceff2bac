package parsekit.grammar;

/**
 * The grammar being declared is inconsistent.
 */
public class GrammarConfigurationException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = 1893457712400921368L;

  public GrammarConfigurationException(String message) {
    super(message);
  }
}
