package parsekit.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Character class, tracked as a list of character ranges.
 *
 * Unlike a canonical range set, ranges here are kept in insertion order and
 * only get merged when one range ends on exactly the character the other
 * starts on (see {@link #addRange(char, char, boolean)}). Ranges coming in
 * through the merging path are expected to not overlap, but this is only
 * checked by {@link #unionWith}.
 *
 * Sets are mutable and not safe for concurrent modification. Each set owns
 * its own list; operations combining two sets copy ranges into a fresh set
 * unless documented as in-place.
 */
public final class CharSet implements Iterable<CharRange> {

  private List<CharRange> ranges = new ArrayList<>();

  public CharSet() { }

  /**
   * Construct a set from pairs of bounds.
   *
   * Every pair gets added through the merging {@link #addRange(char, char)}.
   *
   * @param bounds even number of characters, read as {@code from, to} pairs
   * @return set containing the ranges
   * @throws IllegalArgumentException if there is an odd number of bounds
   */
  public static CharSet of(char... bounds) {
    if (bounds.length % 2 != 0) {
      throw new IllegalArgumentException(
        "Number of range bounds must be even, but got " + bounds.length
      );
    }
    final var set = new CharSet();
    for (int i = 0; i < bounds.length; i += 2) {
      set.addRange(bounds[i], bounds[i + 1]);
    }
    return set;
  }

  /**
   * Ranges in storage order.
   *
   * @return unmodifiable view of the ranges
   */
  public List<CharRange> ranges() {
    return Collections.unmodifiableList(ranges);
  }

  @Override
  public Iterator<CharRange> iterator() {
    return ranges().iterator();
  }

  /**
   * Add a single character.
   *
   * @param character character to add
   */
  public void add(char character) {
    addRange(character, character, true);
  }

  /**
   * Add a range of characters, merging it with an existing range if possible.
   *
   * @param from one bound of the range
   * @param to other bound of the range
   */
  public void addRange(char from, char to) {
    addRange(from, to, true);
  }

  /**
   * Add a range of characters.
   *
   * With {@code combine}, the new range gets absorbed into an existing range
   * that ends exactly on its lower bound (extending that range upwards) or
   * else one that starts exactly on its upper bound (extending it downwards).
   * Ranges which are merely adjacent, like {@code a-c} and {@code d-f}, are
   * not merged.
   *
   * @param from one bound of the range
   * @param to other bound of the range
   * @param combine whether to try merging with an existing range
   */
  public void addRange(char from, char to, boolean combine) {
    final var added = CharRange.between(from, to);

    if (combine) {
      for (int i = 0; i < ranges.size(); i++) {
        final CharRange existing = ranges.get(i);
        if (existing.to() == added.from()) {
          ranges.set(i, existing.withTo(added.to()));
          return;
        }
      }
      for (int i = 0; i < ranges.size(); i++) {
        final CharRange existing = ranges.get(i);
        if (existing.from() == added.to()) {
          ranges.set(i, existing.withFrom(added.from()));
          return;
        }
      }
    }

    ranges.add(added);
  }

  /**
   * Does this set contain at least one character?
   *
   * @return whether there are any ranges in the set
   */
  public boolean any() {
    return !ranges.isEmpty();
  }

  /**
   * Whether some range in the set contains the character.
   *
   * The complexity is {@code O(M)} for {@code M} ranges, since ranges are not
   * necessarily sorted.
   *
   * @param character character
   * @return whether the character is in this set
   */
  public boolean containsChar(char character) {
    for (CharRange range : ranges) {
      if (range.contains(character)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Take the union of two sets.
   *
   * Every range of both sets gets re-added to a fresh set through the merging
   * {@link #addRange(char, char)}. Neither input is modified.
   *
   * @param other set to union with {@code this}
   * @return union of sets
   */
  public CharSet union(CharSet other) {
    final var union = new CharSet();
    for (CharRange range : ranges) {
      union.addRange(range.from(), range.to());
    }
    for (CharRange range : other.ranges) {
      union.addRange(range.from(), range.to());
    }
    return union;
  }

  /**
   * Add (in place) the ranges of another set that are not already present.
   *
   * The incoming ranges must already be partitioned against this set: none
   * of them may start or end on the same character as a range already here,
   * or as another incoming range. This is checked for every range before
   * anything gets added.
   *
   * @param other set whose ranges are added to {@code this}
   * @throws CharSetInvariantException if an incoming range shares a bound
   *   with an existing or another incoming range
   */
  public void unionWith(CharSet other) {
    final var incoming = new LinkedHashSet<CharRange>();
    for (CharRange range : other.ranges) {
      if (!ranges.contains(range)) {
        incoming.add(range);
      }
    }

    // Incoming ranges are checked against each other as well
    final var accepted = new ArrayList<CharRange>(ranges);
    for (CharRange range : incoming) {
      for (CharRange existing : accepted) {
        if (existing.from() == range.from() || existing.to() == range.to()) {
          throw new CharSetInvariantException(existing, range);
        }
      }
      accepted.add(range);
    }

    ranges = accepted;
  }

  /**
   * Take the difference with another set.
   *
   * Each range of this set gets clipped against every excluded range, and
   * the surviving pieces are re-added to a fresh set through the merging
   * {@link #addRange(char, char)}. Neither input is modified.
   *
   * @param excluded characters to remove
   * @return set of characters in {@code this} but not in {@code excluded}
   */
  public CharSet except(CharSet excluded) {
    final var difference = new CharSet();
    final Consumer<CharRange> output =
      (CharRange clipped) -> difference.addRange(clipped.from(), clipped.to());
    for (CharRange range : ranges) {
      clipRange(range.from(), range.to(), excluded.ranges, output);
    }
    return difference;
  }

  /**
   * Clip the range {@code [from, to]} against all of the excluded ranges.
   *
   * Bounds are tracked as {@code int} so that stepping past the ends of the
   * {@code char} range shows up as an empty range instead of wrapping.
   */
  private static void clipRange(
    int from,
    int to,
    List<CharRange> excludedRanges,
    Consumer<CharRange> output
  ) {
    for (CharRange excluded : excludedRanges) {

      // Fully covered: nothing survives
      if (excluded.from() <= from && excluded.to() >= to) {
        return;
      }

      // Strictly inside: split, and clip each half against everything again
      if (excluded.from() > from && excluded.to() < to) {
        clipRange(from, excluded.from() - 1, excludedRanges, output);
        clipRange(excluded.to() + 1, to, excludedRanges, output);
        return;
      }

      // Trim whichever edge overlaps
      if (to >= excluded.from() && to <= excluded.to()) {
        to = excluded.from() - 1;
      }
      if (from >= excluded.from() && from <= excluded.to()) {
        from = excluded.to() + 1;
      }
    }

    if (to < from) {
      return;
    }
    output.accept(CharRange.between((char) from, (char) to));
  }

  /**
   * Split the ranges of this set (in place) along the bounds of another set.
   *
   * Whenever a range of {@code other} starts or ends strictly inside one of
   * the ranges here, that range gets split at that point. Split-off pieces
   * are themselves checked against all of {@code other}, so after one call no
   * range here straddles a bound of {@code other}. Identical ranges collapse
   * and the resulting ranges are stored sorted. {@code other} is not
   * modified.
   *
   * Running this pairwise across a collection of sets until nothing changes
   * gives a common refinement of all of them (see {@link Alphabet#refine}).
   *
   * @param other set whose bounds are used to split this set
   * @return whether any range got split
   */
  public boolean distinguishRanges(CharSet other) {
    boolean changed = false;
    final var distinguished = new TreeSet<CharRange>();
    final var pending = new ArrayDeque<CharRange>(ranges);

    while (!pending.isEmpty()) {
      CharRange range = pending.poll();
      for (CharRange bound : other.ranges) {

        // Other range starts inside this one (but not on its lower bound)
        if (bound.from() > range.from() && bound.from() <= range.to()) {
          pending.add(CharRange.between(bound.from(), range.to()));
          range = range.withTo((char) (bound.from() - 1));
          changed = true;
        }

        // Other range ends inside this one (but not on its upper bound)
        if (bound.to() >= range.from() && bound.to() < range.to()) {
          pending.add(CharRange.between((char) (bound.to() + 1), range.to()));
          range = range.withTo(bound.to());
          changed = true;
        }
      }
      distinguished.add(range);
    }

    ranges = new ArrayList<>(distinguished);
    return changed;
  }

  /**
   * Comma-separated ranges in storage order, or {@code ∅} for the empty set.
   */
  @Override
  public String toString() {
    if (!any()) {
      return "∅";
    }
    return ranges
      .stream()
      .map(CharRange::toString)
      .collect(Collectors.joining(", "));
  }
}
