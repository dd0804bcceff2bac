package parsekit.grammar;

import java.util.function.Function;

/**
 * Source of terminal symbols.
 *
 * Whether repeated requests for the same pattern return the same terminal is
 * up to the implementation.
 *
 * @param <T> type of the values produced while parsing
 */
@FunctionalInterface
public interface TerminalFactory<T> {

  /**
   * Get a terminal for a pattern.
   *
   * @param pattern regular expression matched by the terminal
   * @param action converts matched text into a value (may be {@code null})
   * @return terminal
   */
  Terminal<T> createTerminal(String pattern, Function<String, T> action);
}
