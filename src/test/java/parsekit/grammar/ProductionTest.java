package parsekit.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ProductionTest {

  private final Grammar<Integer> grammar = new Grammar<>();
  private final NonTerminal<Integer> sum = grammar.createNonTerminal("sum");

  @Test
  void noActionOrPrecedenceByDefault() {
    final var production = sum.addProduction(sum, "+", sum);

    assertThat(production.reduceAction()).isEmpty();
    assertThat(production.precedence()).isEmpty();
  }

  @Test
  void reduceFunctionIgnoresError() {
    final var production = sum.addProduction(sum, "+", sum)
      .setReduceFunction(values -> values.get(0) + values.get(2));
    final ReduceAction<Integer> action = production.reduceAction().orElseThrow();
    final var error = new ParseException("unexpected", "+", List.of("number"), 1, 3);

    assertThat(action.reduce(null, List.of(2, 0, 3))).isEqualTo(5);
    assertThat(action.reduce(error, List.of(2, 0, 3))).isEqualTo(5);
  }

  @Test
  void errorFunctionReceivesError() {
    final var production = sum.addProduction("error")
      .setErrorFunction((error, values) -> error.column);
    final var error = new ParseException("unexpected", ")", List.of("number"), 4, 17);

    assertThat(production.reduceAction().orElseThrow().reduce(error, List.of(0))).isEqualTo(17);
  }

  @Test
  void laterActionReplacesEarlierOne() {
    final var production = sum.addProduction("x")
      .setErrorFunction((error, values) -> -1)
      .setReduceFunction(values -> 1);

    assertThat(production.reduceAction().orElseThrow().reduce(null, List.of(0))).isEqualTo(1);
  }

  @Test
  void explicitPrecedence() {
    final var group = new PrecedenceGroup(Associativity.RIGHT, 7);

    final var production = sum.addProduction("-", sum).setPrecedence(group);

    assertThat(production.precedence()).contains(group);
  }

  @Test
  void nullActionIsRejected() {
    final var production = sum.addProduction("x");

    assertThatThrownBy(() -> production.setReduceFunction(null))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> production.setErrorFunction(null))
      .isInstanceOf(NullPointerException.class);
  }

  @Test
  void symbolsAreFixed() {
    final var production = sum.addProduction(sum, "+", sum);

    assertThatThrownBy(() -> production.symbols().clear())
      .isInstanceOf(UnsupportedOperationException.class);
  }
}
