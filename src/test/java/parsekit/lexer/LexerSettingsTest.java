package parsekit.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LexerSettingsTest {

  @Test
  void defaultsEscapeLiteralsAndIgnoreNothing() {
    final var settings = LexerSettings.defaults();

    assertThat(settings.escapeLiterals()).isTrue();
    assertThat(settings.ignore()).isEmpty();
  }

  @Test
  void copiesWithChanges() {
    final var settings = LexerSettings.defaults()
      .withEscapeLiterals(false)
      .withIgnore("\\s+", "//[^\\n]*");

    assertThat(settings.escapeLiterals()).isFalse();
    assertThat(settings.ignore()).containsExactly("\\s+", "//[^\\n]*");
    assertThat(LexerSettings.defaults().escapeLiterals()).isTrue();
  }
}
