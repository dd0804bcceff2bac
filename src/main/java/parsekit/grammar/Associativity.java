package parsekit.grammar;

/**
 * How operators of the same precedence group together.
 */
public enum Associativity {

  /**
   * {@code a + b + c} is {@code (a + b) + c}: prefer reduce.
   */
  LEFT,

  /**
   * {@code a ^ b ^ c} is {@code a ^ (b ^ c)}: prefer shift.
   */
  RIGHT,

  /**
   * {@code a < b < c} is an error.
   */
  NON_ASSOCIATIVE
}
