package parsekit.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CharRangeTest {

  @Test
  void reversedBoundsAreSwapped() {
    final var range = CharRange.between('z', 'a');

    assertThat(range.from()).isEqualTo('a');
    assertThat(range.to()).isEqualTo('z');
    assertThat(range).isEqualTo(CharRange.between('a', 'z'));
  }

  @Test
  void displaysSingleCharacterWithoutDash() {
    assertThat(CharRange.single('x')).hasToString("x");
    assertThat(CharRange.between('a', 'f')).hasToString("a-f");
  }

  @Test
  void displaysControlCharactersEscaped() {
    assertThat(CharRange.between('\t', '\n')).hasToString("\\u0009-\\u000A");
    assertThat(CharRange.single(' ')).hasToString("\\u0020");
  }

  @Test
  void containsIsInclusive() {
    final var range = CharRange.between('b', 'd');

    assertThat(range.contains('a')).isFalse();
    assertThat(range.contains('b')).isTrue();
    assertThat(range.contains('c')).isTrue();
    assertThat(range.contains('d')).isTrue();
    assertThat(range.contains('e')).isFalse();
  }

  @Test
  void overlap() {
    final var range = CharRange.between('c', 'f');

    assertThat(range.overlapsWith(CharRange.between('a', 'c'))).isTrue();
    assertThat(range.overlapsWith(CharRange.between('f', 'z'))).isTrue();
    assertThat(range.overlapsWith(CharRange.between('d', 'e'))).isTrue();
    assertThat(range.overlapsWith(CharRange.between('a', 'b'))).isFalse();
    assertThat(range.overlapsWith(CharRange.between('g', 'z'))).isFalse();
    assertThat(range.overlapsWith(null)).isFalse();
  }

  @Test
  void orderedByLowerThenUpperBound() {
    assertThat(CharRange.between('a', 'c')).isLessThan(CharRange.between('b', 'c'));
    assertThat(CharRange.between('a', 'c')).isLessThan(CharRange.between('a', 'd'));
    assertThat(CharRange.between('a', 'c')).isEqualByComparingTo(CharRange.between('c', 'a'));
  }
}
