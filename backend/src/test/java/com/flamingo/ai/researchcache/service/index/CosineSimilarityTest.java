package com.flamingo.ai.researchcache.service.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CosineSimilarity Tests")
class CosineSimilarityTest {

  @Test
  @DisplayName("Should score parallel, orthogonal and opposite vectors")
  void shouldScoreBasicCases() {
    assertThat(CosineSimilarity.between(new float[] {1f, 2f}, new float[] {2f, 4f}))
        .isCloseTo(1.0, within(1e-9));
    assertThat(CosineSimilarity.between(new float[] {1f, 0f}, new float[] {0f, 3f}))
        .isCloseTo(0.0, within(1e-9));
    assertThat(CosineSimilarity.between(new float[] {1f, 1f}, new float[] {-1f, -1f}))
        .isCloseTo(-1.0, within(1e-9));
  }

  @Test
  @DisplayName("Should ignore magnitude")
  void shouldIgnoreMagnitude() {
    double small = CosineSimilarity.between(new float[] {3f, 4f}, new float[] {4f, 3f});
    double large = CosineSimilarity.between(new float[] {300f, 400f}, new float[] {4f, 3f});

    assertThat(small).isCloseTo(0.96, within(1e-6)).isCloseTo(large, within(1e-9));
  }

  @Test
  @DisplayName("Should return zero for a zero vector")
  void shouldReturnZeroForZeroVector() {
    assertThat(CosineSimilarity.between(new float[3], new float[] {1f, 2f, 3f})).isZero();
  }

  @Test
  @DisplayName("Should stay within [-1, 1]")
  void shouldStayInRange() {
    float[] v = {0.1f, 0.7f, 0.3f, 0.9f};

    assertThat(CosineSimilarity.between(v, v)).isLessThanOrEqualTo(1.0);
  }

  @Test
  @DisplayName("Should reject vectors of different width")
  void shouldRejectDifferentWidths() {
    assertThatThrownBy(() -> CosineSimilarity.between(new float[2], new float[3]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
