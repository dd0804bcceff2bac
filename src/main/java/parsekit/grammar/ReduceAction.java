package parsekit.grammar;

import java.util.List;

/**
 * Action run when a production is reduced.
 *
 * Normal reductions and error-recovery reductions share this signature;
 * normal ones just ignore the error.
 *
 * @param <T> type of the values produced while parsing
 */
@FunctionalInterface
public interface ReduceAction<T> {

  /**
   * Combine the values of the matched symbols into the production's value.
   *
   * @param error what went wrong, for error-recovery productions (may be
   *              {@code null} and is ignored by normal reductions)
   * @param values one value per symbol of the production, in order
   * @return value of the production's result symbol
   */
  T reduce(ParseException error, List<T> values);
}
