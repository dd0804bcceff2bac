package parsekit.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class AlphabetTest {

  private static CharRange range(char from, char to) {
    return CharRange.between(from, to);
  }

  @Test
  void overlappingClassesRefineToSharedBlocks() {
    final var identifier = CharSet.of('a', 'z', 'A', 'Z');
    final var hex = CharSet.of('0', '9', 'a', 'f', 'A', 'F');
    final var keywordStart = CharSet.of('i', 'i');
    final List<CharSet> classes = List.of(identifier, hex, keywordStart);

    final List<CharRange> alphabet = Alphabet.of(classes);

    assertThat(alphabet).containsExactly(
      range('0', '9'),
      range('A', 'F'),
      range('G', 'Z'),
      range('a', 'f'),
      range('g', 'h'),
      CharRange.single('i'),
      range('j', 'z')
    );
  }

  @Test
  void refinedClassesAreIdenticalOrDisjoint() {
    final var first = CharSet.of('a', 'm', 'x', 'z');
    final var second = CharSet.of('f', 'y');
    final var third = CharSet.of('c', 'c', 'k', 'p');
    final List<CharSet> classes = List.of(first, second, third);

    Alphabet.refine(classes);

    for (CharSet left : classes) {
      for (CharSet right : classes) {
        for (CharRange r1 : left) {
          for (CharRange r2 : right) {
            assertThat(r1.equals(r2) || !r1.overlapsWith(r2))
              .as("%s and %s", r1, r2)
              .isTrue();
          }
        }
      }
    }
  }

  @Test
  void refinementKeepsMembership() {
    final var first = CharSet.of('a', 'm', 'x', 'z');
    final var second = CharSet.of('f', 'y');
    final var firstBefore = first.union(new CharSet());
    final var secondBefore = second.union(new CharSet());

    Alphabet.refine(List.of(first, second));

    for (char c = 'A'; c <= 'z'; c++) {
      assertThat(first.containsChar(c)).isEqualTo(firstBefore.containsChar(c));
      assertThat(second.containsChar(c)).isEqualTo(secondBefore.containsChar(c));
    }
  }

  @Test
  void classWithOverlappingRangesIsSplitAgainstItself() {
    final var overlapping = CharSet.of('a', 'f', 'c', 'h');

    final List<CharRange> alphabet = Alphabet.of(List.of(overlapping));

    assertThat(alphabet).containsExactly(range('a', 'b'), range('c', 'f'), range('g', 'h'));
    assertThat(overlapping.ranges()).containsExactlyElementsOf(alphabet);
  }

  @Test
  void alreadyDisjointClassesTakeOnePass() {
    final List<CharSet> classes = List.of(CharSet.of('a', 'c'), CharSet.of('x', 'z'));

    assertThat(Alphabet.refine(classes)).isEqualTo(1);
  }

  @Test
  void overlappingClassesTakeMoreThanOnePass() {
    final List<CharSet> classes = List.of(CharSet.of('a', 'z'), CharSet.of('m', 'm'));

    assertThat(Alphabet.refine(classes)).isEqualTo(2);
  }
}
