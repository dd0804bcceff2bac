package parsekit.grammar;

import java.util.Objects;
import parsekit.lexer.LexerSettings;

/**
 * Everything a {@link NonTerminal} needs to turn production parts into symbols.
 *
 * @param lexerSettings settings deciding how literal parts become patterns
 * @param terminalFactory creates terminals for literal parts
 * @param <T> type of the values produced while parsing
 */
public record ProductionContext<T>(
  LexerSettings lexerSettings,
  TerminalFactory<T> terminalFactory
) {

  public ProductionContext {
    Objects.requireNonNull(lexerSettings, "lexerSettings");
    Objects.requireNonNull(terminalFactory, "terminalFactory");
  }
}
