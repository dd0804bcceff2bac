package parsekit.grammar;

/**
 * Grammar symbol: either a {@link Terminal} or a {@link NonTerminal}.
 *
 * Symbols are compared by identity. The debug name is only used for
 * diagnostics.
 *
 * @param <T> type of the values produced while parsing
 */
public abstract sealed class Symbol<T> permits Terminal, NonTerminal {

  private String debugName;

  protected Symbol(String debugName) {
    this.debugName = debugName;
  }

  /**
   * Human readable name used in diagnostics and grammar dumps.
   */
  public String debugName() {
    return debugName;
  }

  public void setDebugName(String debugName) {
    this.debugName = debugName;
  }

  @Override
  public String toString() {
    return debugName;
  }
}
