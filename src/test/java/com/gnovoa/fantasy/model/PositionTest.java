package com.gnovoa.fantasy.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PositionTest {

  @Test
  void resolvesLabelsAndEnumNames() {
    assertThat(Position.fromName("Goalkeeper")).isEqualTo(Position.GOALKEEPER);
    assertThat(Position.fromName("defender")).isEqualTo(Position.DEFENDER);
    assertThat(Position.fromName(" MIDFIELDER ")).isEqualTo(Position.MIDFIELDER);
    assertThat(Position.fromName("Forward")).isEqualTo(Position.FORWARD);
  }

  @Test
  void rejectsUnknownNames() {
    assertThatThrownBy(() -> Position.fromName("Winger"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Position.fromName(" ")).isInstanceOf(IllegalArgumentException.class);
  }
}
