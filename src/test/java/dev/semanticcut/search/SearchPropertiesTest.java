package dev.semanticcut.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchPropertiesTest {

  @Test
  void defaultsMatchDocumentedValues() {
    var props = new SearchProperties();

    assertThat(props.isUseQueryLlm()).isTrue();
    assertThat(props.isHybridQuery()).isTrue();
    assertThat(props.getInitialK()).isEqualTo(20);
    assertThat(props.getReturnTop()).isEqualTo(5);
    assertThat(props.getFilterFallbackMin()).isEqualTo(5);
    assertThat(props.getRerankMinScore()).isZero();
    assertThat(props.getRrfK()).isEqualTo(ReciprocalRankFusion.DEFAULT_K);
    assertThatCode(props::validate).doesNotThrowAnyException();
  }

  @Test
  void initialKOutOfRangeFailsValidation() {
    var props = new SearchProperties();
    props.setInitialK(101);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("initial-k");
  }

  @Test
  void returnTopOutOfRangeFailsValidation() {
    var props = new SearchProperties();
    props.setReturnTop(0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("return-top");
  }

  @Test
  void nonPositiveRrfKFailsValidation() {
    var props = new SearchProperties();
    props.setRrfK(0);

    assertThatThrownBy(props::validate).isInstanceOf(IllegalStateException.class);
  }
}
