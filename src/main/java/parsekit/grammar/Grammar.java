package parsekit.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import parsekit.lexer.LexerSettings;

/**
 * Entry point for declaring a grammar.
 *
 * Owns the lexer settings and the terminals, creates non-terminals wired up
 * with those, and records operator precedence. The finished grammar is read
 * (but not modified) by table construction.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * final var grammar = new Grammar<Integer>();
 * final var number = grammar.createTerminal("[0-9]+", Integer::parseInt);
 * final var expr = grammar.createNonTerminal("expr");
 * expr.addProduction(expr, "+", expr).setReduceFunction(v -> v.get(0) + v.get(2));
 * expr.addProduction(number).setReduceFunction(v -> v.get(0));
 * grammar.leftAssociative("+");
 * grammar.setStartSymbol(expr);
 * }</pre>
 *
 * @param <T> type of the values produced while parsing
 */
public final class Grammar<T> {

  private static final Logger logger = LoggerFactory.getLogger(Grammar.class);

  private final LexerSettings lexerSettings;
  private final TerminalRegistry<T> terminals = new TerminalRegistry<>();
  private final ProductionContext<T> context;
  private final List<NonTerminal<T>> nonTerminals = new ArrayList<>();

  // Symbols have identity semantics
  private final Map<Terminal<T>, PrecedenceGroup> precedences = new IdentityHashMap<>();
  private int lastPrecedenceLevel = 0;

  private NonTerminal<T> startSymbol;

  public Grammar() {
    this(LexerSettings.defaults());
  }

  public Grammar(LexerSettings lexerSettings) {
    this.lexerSettings = Objects.requireNonNull(lexerSettings, "lexerSettings");
    this.context = new ProductionContext<T>(lexerSettings, terminals);
  }

  public LexerSettings lexerSettings() {
    return lexerSettings;
  }

  /**
   * Create a non-terminal that belongs to this grammar.
   *
   * @param name debug name
   * @return new non-terminal
   */
  public NonTerminal<T> createNonTerminal(String name) {
    final var nonTerminal = new NonTerminal<T>(name, context);
    nonTerminals.add(nonTerminal);
    logger.debug("Declared non-terminal {}", name);
    return nonTerminal;
  }

  /**
   * Get the terminal for a pattern, with no value.
   *
   * @param pattern regular expression (not escaped)
   * @return terminal
   */
  public Terminal<T> createTerminal(String pattern) {
    return createTerminal(pattern, null);
  }

  /**
   * Get the terminal for a pattern.
   *
   * @param pattern regular expression (not escaped)
   * @param action converts matched text into a value
   * @return terminal
   * @throws GrammarConfigurationException if the pattern already has a
   *   different action
   */
  public Terminal<T> createTerminal(String pattern, Function<String, T> action) {
    return terminals.createTerminal(pattern, action);
  }

  /**
   * Non-terminals, in order of creation.
   */
  public List<NonTerminal<T>> nonTerminals() {
    return List.copyOf(nonTerminals);
  }

  /**
   * Terminals, in order of creation.
   */
  public List<Terminal<T>> terminals() {
    return terminals.terminals();
  }

  public void setStartSymbol(NonTerminal<T> startSymbol) {
    this.startSymbol = Objects.requireNonNull(startSymbol, "startSymbol");
  }

  public Optional<NonTerminal<T>> startSymbol() {
    return Optional.ofNullable(startSymbol);
  }

  /**
   * All productions, numbered by position in this list.
   *
   * Productions are ordered by non-terminal creation, then by the order they
   * were added to their non-terminal.
   */
  public List<Production<T>> productions() {
    final var productions = new ArrayList<Production<T>>();
    for (NonTerminal<T> nonTerminal : nonTerminals) {
      productions.addAll(nonTerminal.productions());
    }
    return productions;
  }

  /**
   * Declare left-associative terminals, binding tighter than every earlier
   * declaration.
   *
   * @param symbols terminals or literal strings
   * @return the new precedence group
   */
  public PrecedenceGroup leftAssociative(Object... symbols) {
    return declarePrecedence(Associativity.LEFT, symbols);
  }

  /**
   * Declare right-associative terminals, binding tighter than every earlier
   * declaration.
   *
   * @param symbols terminals or literal strings
   * @return the new precedence group
   */
  public PrecedenceGroup rightAssociative(Object... symbols) {
    return declarePrecedence(Associativity.RIGHT, symbols);
  }

  /**
   * Declare non-associative terminals, binding tighter than every earlier
   * declaration.
   *
   * @param symbols terminals or literal strings
   * @return the new precedence group
   */
  public PrecedenceGroup nonAssociative(Object... symbols) {
    return declarePrecedence(Associativity.NON_ASSOCIATIVE, symbols);
  }

  private PrecedenceGroup declarePrecedence(Associativity associativity, Object[] symbols) {
    final var parts = new ArrayList<ProductionPart<T>>(symbols.length);
    for (int i = 0; i < symbols.length; i++) {
      final ProductionPart<T> part = ProductionPart.from(symbols[i], i);
      if (part instanceof ProductionPart.SymbolRef<T> ref && !(ref.symbol() instanceof Terminal<T>)) {
        throw new GrammarConfigurationException(
          "Only terminals can have a precedence, but " + ref.symbol().debugName() + " is a non-terminal"
        );
      }
      parts.add(part);
    }

    // Check for repeats before any terminal gets created
    final Set<Terminal<T>> known = Collections.newSetFromMap(new IdentityHashMap<>());
    final Set<String> newPatterns = new HashSet<>();
    for (ProductionPart<T> part : parts) {
      final Terminal<T> terminal;
      final String name;
      if (part instanceof ProductionPart.Literal<T> literal) {
        final String pattern = literal.pattern(lexerSettings);
        terminal = terminals.find(pattern).orElse(null);
        name = literal.text();
        if (terminal == null && !newPatterns.add(pattern)) {
          throw alreadyDeclared(name);
        }
      } else {
        terminal = (Terminal<T>) ((ProductionPart.SymbolRef<T>) part).symbol();
        name = terminal.debugName();
      }
      if (terminal != null && (precedences.containsKey(terminal) || !known.add(terminal))) {
        throw alreadyDeclared(name);
      }
    }

    final var declared = new ArrayList<Terminal<T>>(parts.size());
    for (ProductionPart<T> part : parts) {
      declared.add((Terminal<T>) part.toSymbol(context));
    }

    final var group = new PrecedenceGroup(associativity, ++lastPrecedenceLevel);
    for (Terminal<T> terminal : declared) {
      precedences.put(terminal, group);
    }
    logger.debug("Declared {} precedence level {} for {}", associativity, group.level(), declared);
    return group;
  }

  private static GrammarConfigurationException alreadyDeclared(String name) {
    return new GrammarConfigurationException("Precedence of " + name + " is already declared");
  }

  /**
   * Precedence declared for a terminal.
   *
   * @param symbol symbol (non-terminals never have a precedence)
   * @return precedence group, if one was declared
   */
  public Optional<PrecedenceGroup> precedenceOf(Symbol<T> symbol) {
    return Optional.ofNullable(precedences.get(symbol));
  }

  /**
   * Precedence to use for a production when resolving conflicts.
   *
   * This is the production's own precedence if it has one, and otherwise
   * that of its rightmost terminal with a declared precedence.
   *
   * @param production production of this grammar
   * @return precedence group, if any applies
   */
  public Optional<PrecedenceGroup> effectivePrecedence(Production<T> production) {
    final Optional<PrecedenceGroup> explicit = production.precedence();
    if (explicit.isPresent()) {
      return explicit;
    }

    final List<Symbol<T>> symbols = production.symbols();
    for (int i = symbols.size() - 1; i >= 0; i--) {
      final PrecedenceGroup group = precedences.get(symbols.get(i));
      if (group != null) {
        return Optional.of(group);
      }
    }
    return Optional.empty();
  }

  /**
   * Numbered listing of the productions.
   */
  @Override
  public String toString() {
    final var builder = new StringBuilder();
    final List<Production<T>> productions = productions();
    for (int i = 0; i < productions.size(); i++) {
      builder.append(i).append(": ").append(productions.get(i)).append('\n');
    }
    return builder.toString();
  }
}
