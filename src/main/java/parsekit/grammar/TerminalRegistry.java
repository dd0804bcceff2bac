package parsekit.grammar;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal factory handing out one terminal per distinct pattern.
 *
 * Asking again for a known pattern returns the existing terminal. A terminal
 * with an action should therefore be declared before its pattern shows up as
 * a plain literal.
 *
 * @param <T> type of the values produced while parsing
 */
public final class TerminalRegistry<T> implements TerminalFactory<T> {

  private static final Logger logger = LoggerFactory.getLogger(TerminalRegistry.class);

  // Keyed by pattern, in order of first creation
  private final Map<String, Terminal<T>> terminals = new LinkedHashMap<>();

  /**
   * Get the terminal for a pattern, creating it if needed.
   *
   * @param pattern regular expression matched by the terminal
   * @param action converts matched text into a value (may be {@code null})
   * @return terminal for the pattern
   * @throws GrammarConfigurationException if the pattern is already bound to
   *   a terminal with a different action
   */
  @Override
  public Terminal<T> createTerminal(String pattern, Function<String, T> action) {
    final Terminal<T> existing = terminals.get(pattern);
    if (existing != null) {
      if (action != null && action != existing.action()) {
        throw new GrammarConfigurationException(
          "Terminal pattern " + pattern + " is already defined with a different action"
        );
      }
      logger.debug("Reusing terminal for pattern {}", pattern);
      return existing;
    }

    final var terminal = new Terminal<T>(pattern, action);
    terminals.put(pattern, terminal);
    return terminal;
  }

  /**
   * Find the terminal already created for a pattern.
   *
   * @param pattern regular expression
   * @return terminal, if there is one
   */
  public Optional<Terminal<T>> find(String pattern) {
    return Optional.ofNullable(terminals.get(pattern));
  }

  /**
   * All terminals, in order of creation.
   */
  public List<Terminal<T>> terminals() {
    return List.copyOf(terminals.values());
  }
}
