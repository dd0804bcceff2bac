package parsekit.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbol defined by one or more productions.
 *
 * Productions are kept in the order they were added; that order is what
 * numbers them in the grammar. Not safe for concurrent modification.
 *
 * @param <T> type of the values produced while parsing
 */
public final class NonTerminal<T> extends Symbol<T> {

  private static final Logger logger = LoggerFactory.getLogger(NonTerminal.class);

  private final ProductionContext<T> context;
  private final List<Production<T>> productions = new ArrayList<>();

  /**
   * @param debugName name used in diagnostics
   * @param context how literal production parts turn into terminals
   */
  public NonTerminal(String debugName, ProductionContext<T> context) {
    super(debugName);
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Productions of this non-terminal, in the order they were added.
   */
  public List<Production<T>> productions() {
    return Collections.unmodifiableList(productions);
  }

  /**
   * Add a production from loosely typed parts.
   *
   * Every part must be a {@code String} (literal text), a {@link Symbol}, or
   * a {@link ProductionPart}. All parts are checked before anything else
   * happens.
   *
   * @param parts body of the production
   * @return the new production, for setting its action and precedence
   * @throws InvalidGrammarPartException if a part is of any other type or is
   *   {@code null}
   */
  public Production<T> addProduction(Object... parts) {
    final var typedParts = new ArrayList<ProductionPart<T>>(parts.length);
    for (int i = 0; i < parts.length; i++) {
      typedParts.add(ProductionPart.from(parts[i], i));
    }
    return addProduction(typedParts);
  }

  /**
   * Add a production.
   *
   * Literal parts become terminals through the context's terminal factory,
   * escaped first if the lexer settings ask for it. The terminal's debug name
   * is the unescaped literal.
   *
   * @param parts body of the production
   * @return the new production, for setting its action and precedence
   * @throws InvalidGrammarPartException if a part is {@code null}
   */
  public Production<T> addProduction(List<ProductionPart<T>> parts) {
    for (int i = 0; i < parts.size(); i++) {
      if (parts.get(i) == null) {
        throw new InvalidGrammarPartException(null, i);
      }
    }

    final var symbols = new ArrayList<Symbol<T>>(parts.size());
    for (ProductionPart<T> part : parts) {
      symbols.add(part.toSymbol(context));
    }

    final var production = new Production<T>(this, symbols);
    productions.add(production);
    logger.debug("Added production {}", production);
    return production;
  }

  @Override
  public String toString() {
    return debugName() + " =>";
  }
}
