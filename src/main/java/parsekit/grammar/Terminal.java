package parsekit.grammar;

import java.util.Objects;
import java.util.function.Function;

/**
 * Symbol matched directly against the input using a regular expression.
 *
 * Terminals are normally obtained from a {@link TerminalFactory} rather than
 * constructed directly.
 *
 * @param <T> type of the values produced while parsing
 */
public final class Terminal<T> extends Symbol<T> {

  private final String pattern;
  private final Function<String, T> action;

  /**
   * @param pattern regular expression matching the terminal
   * @param action turns the matched text into a value ({@code null} for a
   *               terminal whose value is always {@code null})
   */
  public Terminal(String pattern, Function<String, T> action) {
    super(Objects.requireNonNull(pattern, "pattern"));
    this.pattern = pattern;
    this.action = action;
  }

  /**
   * Regular expression the lexer matches for this terminal.
   */
  public String pattern() {
    return pattern;
  }

  /**
   * Action converting matched text to a value, if there is one.
   */
  public Function<String, T> action() {
    return action;
  }

  /**
   * Convert matched text into this terminal's value.
   *
   * @param lexeme text matched by {@link #pattern()}
   * @return value of the token, or {@code null} if there is no action
   */
  public T parse(String lexeme) {
    return action == null ? null : action.apply(lexeme);
  }
}
