package parsekit.lexer;

import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computing a shared, disjoint input alphabet from character classes.
 *
 * Automaton construction wants to transition on blocks of characters that
 * every character class either fully contains or fully excludes. Refining
 * the classes against each other until no more splits happen gives exactly
 * those blocks.
 */
public final class Alphabet {

  private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

  private Alphabet() { }

  /**
   * Refine (in place) the character classes against each other.
   *
   * Every ordered pair of classes (including each class with itself) gets
   * run through {@link CharSet#distinguishRanges}, and whole passes get
   * repeated until one of them changes nothing. After this, any two ranges,
   * from the same class or from different ones, are either identical or
   * disjoint.
   *
   * @param classes character classes to refine
   * @return number of passes made, including the final one that changed nothing
   */
  public static int refine(List<CharSet> classes) {
    int passes = 0;
    boolean changed;
    do {
      changed = false;
      passes++;
      for (CharSet refined : classes) {
        for (CharSet other : classes) {
          if (refined.distinguishRanges(other)) {
            changed = true;
          }
        }
      }
    } while (changed);

    logger.debug("Refined {} character classes in {} passes", classes.size(), passes);
    return passes;
  }

  /**
   * Refine the character classes and collect the distinct ranges.
   *
   * @param classes character classes to refine (modified in place)
   * @return sorted, pairwise disjoint ranges used by any of the classes
   */
  public static List<CharRange> of(List<CharSet> classes) {
    refine(classes);

    final var alphabet = new TreeSet<CharRange>();
    for (CharSet refined : classes) {
      alphabet.addAll(refined.ranges());
    }

    logger.debug("Alphabet has {} ranges", alphabet.size());
    return List.copyOf(alphabet);
  }
}
