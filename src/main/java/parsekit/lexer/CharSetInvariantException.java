package parsekit.lexer;

/**
 * A {@link CharSet} operation was handed ranges that break its precondition.
 *
 * This signals a bug in how the caller partitioned its character classes,
 * not bad user input. The colliding ranges are exposed so that callers can
 * check exactly what went wrong without looking at the message.
 */
public class CharSetInvariantException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = 3120954487236015874L;

  /**
   * Range already present in the receiving set.
   */
  public final CharRange existingRange;

  /**
   * Range that was being added and collided with {@link #existingRange}.
   */
  public final CharRange incomingRange;

  public CharSetInvariantException(CharRange existingRange, CharRange incomingRange) {
    super(
      "Range " + incomingRange + " shares a bound with existing range " + existingRange
    );
    this.existingRange = existingRange;
    this.incomingRange = incomingRange;
  }
}
