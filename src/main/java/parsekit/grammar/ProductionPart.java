package parsekit.grammar;

import java.util.Objects;
import parsekit.lexer.LexerSettings;
import parsekit.util.RegexLiterals;

/**
 * One element of a production body: literal text or a symbol.
 *
 * @param <T> type of the values produced while parsing
 */
public sealed interface ProductionPart<T> permits ProductionPart.Literal, ProductionPart.SymbolRef {

  /**
   * Resolve this part to the symbol that goes into the production.
   *
   * @param context settings and terminal factory of the grammar
   * @return symbol for this part
   */
  Symbol<T> toSymbol(ProductionContext<T> context);

  /**
   * Literal text, turned into a terminal matching exactly that text (or, with
   * escaping turned off, a terminal using the text as its pattern).
   *
   * @param text literal text, also used as the terminal's debug name
   */
  record Literal<T>(String text) implements ProductionPart<T> {

    public Literal {
      Objects.requireNonNull(text, "text");
    }

    /**
     * Pattern the terminal for this literal is created with.
     *
     * @param settings lexer settings deciding whether to escape
     * @return regular expression for the literal
     */
    public String pattern(LexerSettings settings) {
      return settings.escapeLiterals() ? RegexLiterals.escape(text) : text;
    }

    @Override
    public Symbol<T> toSymbol(ProductionContext<T> context) {
      final String pattern = pattern(context.lexerSettings());
      final Terminal<T> terminal = context.terminalFactory().createTerminal(pattern, null);
      terminal.setDebugName(text);
      return terminal;
    }
  }

  /**
   * Reference to an existing terminal or non-terminal.
   *
   * @param symbol referenced symbol
   */
  record SymbolRef<T>(Symbol<T> symbol) implements ProductionPart<T> {

    public SymbolRef {
      Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public Symbol<T> toSymbol(ProductionContext<T> context) {
      return symbol;
    }
  }

  static <T> ProductionPart<T> literal(String text) {
    return new Literal<T>(text);
  }

  static <T> ProductionPart<T> symbol(Symbol<T> symbol) {
    return new SymbolRef<T>(symbol);
  }

  /**
   * Classify a loosely typed part.
   *
   * @param part a {@code String}, a {@link Symbol}, or a {@code ProductionPart}
   * @param index position of the part, for error reporting
   * @return typed part
   * @throws InvalidGrammarPartException if the part is none of the above
   */
  @SuppressWarnings("unchecked")
  static <T> ProductionPart<T> from(Object part, int index) {
    if (part instanceof ProductionPart<?> typed) {
      return (ProductionPart<T>) typed;
    } else if (part instanceof String text) {
      return new Literal<T>(text);
    } else if (part instanceof Symbol<?> symbol) {
      return new SymbolRef<T>((Symbol<T>) symbol);
    } else {
      throw new InvalidGrammarPartException(part, index);
    }
  }
}
