package parsekit.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class RegexLiteralsTest {

  @Test
  void escapesMetacharacters() {
    assertThat(RegexLiterals.escape("(")).isEqualTo("\\(");
    assertThat(RegexLiterals.escape("a+b*")).isEqualTo("a\\+b\\*");
    assertThat(RegexLiterals.escape("\\")).isEqualTo("\\\\");
  }

  @Test
  void leavesPlainTextAlone() {
    assertThat(RegexLiterals.escape("while")).isEqualTo("while");
    assertThat(RegexLiterals.escape("")).isEmpty();
  }

  @Test
  void escapedLiteralMatchesOnlyItself() {
    final String literal = "a.b|(c)[d]{2}^$?";

    final var pattern = Pattern.compile(RegexLiterals.escape(literal));

    assertThat(pattern.matcher(literal).matches()).isTrue();
    assertThat(pattern.matcher("axb|(c)[d]{2}^$?").matches()).isFalse();
  }
}
