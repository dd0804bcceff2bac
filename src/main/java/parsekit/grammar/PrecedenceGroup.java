package parsekit.grammar;

import java.util.Objects;

/**
 * Precedence level used to resolve shift/reduce conflicts.
 *
 * Higher levels bind tighter.
 *
 * @param associativity how operators of this group combine with each other
 * @param level precedence level
 */
public record PrecedenceGroup(
  Associativity associativity,
  int level
) {

  public PrecedenceGroup {
    Objects.requireNonNull(associativity, "associativity");
  }
}
