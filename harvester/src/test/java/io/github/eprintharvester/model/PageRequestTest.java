package io.github.eprintharvester.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PageRequestTest {

  @Test
  void initial_carriesSetAndBounds() {
    final PageRequest request = PageRequest.initial("math", "arXiv",
        Optional.of(LocalDate.of(2010, 1, 1)), Optional.empty());

    assertThat(request.isContinuation()).isFalse();
    assertThat(request.setName()).contains("math");
    assertThat(request.from()).contains(LocalDate.of(2010, 1, 1));
    assertThat(request.cursor()).isEmpty();
  }

  @Test
  void continuation_carriesOnlyCursor() {
    final PageRequest request = PageRequest.continuation("6125483|1001");

    assertThat(request.isContinuation()).isTrue();
    assertThat(request.setName()).isEmpty();
    assertThat(request.from()).isEmpty();
  }

  @Test
  void continuation_withBounds_isRejected() {
    assertThatThrownBy(() -> ImmutablePageRequest.builder()
        .cursor("c1")
        .from(LocalDate.of(2010, 1, 1))
        .build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void continuation_blankCursor_isRejected() {
    assertThatThrownBy(() -> PageRequest.continuation(" "))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void initial_withoutSet_isRejected() {
    assertThatThrownBy(() -> ImmutablePageRequest.builder().metadataPrefix("arXiv").build())
        .isInstanceOf(IllegalStateException.class);
  }
}
