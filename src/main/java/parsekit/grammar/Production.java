package parsekit.grammar;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One alternative expansion of a non-terminal.
 *
 * The symbols are fixed once the production exists. The reduce action and
 * precedence are meant to be set once, while the grammar is still being
 * declared.
 *
 * @param <T> type of the values produced while parsing
 */
public final class Production<T> {

  private final NonTerminal<T> resultSymbol;
  private final List<Symbol<T>> symbols;
  private ReduceAction<T> reduceAction;
  private PrecedenceGroup precedence;

  Production(NonTerminal<T> resultSymbol, List<Symbol<T>> symbols) {
    this.resultSymbol = resultSymbol;
    this.symbols = List.copyOf(symbols);
  }

  /**
   * Non-terminal that this production expands.
   */
  public NonTerminal<T> resultSymbol() {
    return resultSymbol;
  }

  /**
   * Body of the production (empty for an epsilon production).
   */
  public List<Symbol<T>> symbols() {
    return symbols;
  }

  /**
   * Action run on reduction, in the shared normal/error form.
   */
  public Optional<ReduceAction<T>> reduceAction() {
    return Optional.ofNullable(reduceAction);
  }

  /**
   * Precedence set explicitly on this production.
   *
   * When empty, conflict resolution falls back on the precedence of the
   * rightmost terminal (see {@link Grammar#effectivePrecedence}).
   */
  public Optional<PrecedenceGroup> precedence() {
    return Optional.ofNullable(precedence);
  }

  /**
   * Set a normal reduction.
   *
   * The action is wrapped so that it can be called with an error like any
   * other {@link ReduceAction}; the error is ignored.
   *
   * @param action combines the symbols' values into the result value
   * @return this production
   */
  public Production<T> setReduceFunction(Function<List<T>, T> action) {
    Objects.requireNonNull(action, "action");
    this.reduceAction = (error, values) -> action.apply(values);
    return this;
  }

  /**
   * Set an error-recovery reduction, which also receives the parse error.
   *
   * @param handler combines the error and the symbols' values into the result value
   * @return this production
   */
  public Production<T> setErrorFunction(ReduceAction<T> handler) {
    this.reduceAction = Objects.requireNonNull(handler, "handler");
    return this;
  }

  /**
   * Override the precedence used for this production in conflict resolution.
   *
   * @param group precedence group
   * @return this production
   */
  public Production<T> setPrecedence(PrecedenceGroup group) {
    this.precedence = Objects.requireNonNull(group, "group");
    return this;
  }

  @Override
  public String toString() {
    final String body = symbols.isEmpty()
      ? "ε"
      : symbols.stream().map(Symbol::debugName).collect(Collectors.joining(" "));
    return resultSymbol.debugName() + " => " + body;
  }
}
