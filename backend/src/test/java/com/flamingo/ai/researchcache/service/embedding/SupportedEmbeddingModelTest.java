package com.flamingo.ai.researchcache.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.researchcache.exception.UnsupportedEmbeddingModelException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("SupportedEmbeddingModel Tests")
class SupportedEmbeddingModelTest {

  @ParameterizedTest
  @CsvSource({
    "all-MiniLM-L6-v2, 384",
    "bge-small-en-v1.5, 384",
    "all-mpnet-base-v2, 768",
    "bge-base-en-v1.5, 768",
    "text-embedding-3-small, 1536",
    "text-embedding-3-large, 3072"
  })
  @DisplayName("Should map each catalog name to its fixed dimension")
  void shouldMapNameToDimension(String name, int dimension) {
    assertThat(SupportedEmbeddingModel.fromName(name).dimension()).isEqualTo(dimension);
  }

  @Test
  @DisplayName("Should match names ignoring case and surrounding blanks")
  void shouldMatchIgnoringCase() {
    assertThat(SupportedEmbeddingModel.fromName("  ALL-minilm-l6-V2 "))
        .isEqualTo(SupportedEmbeddingModel.ALL_MINILM_L6_V2);
  }

  @Test
  @DisplayName("Should list supported models when the name is unknown")
  void shouldRejectUnknownName() {
    assertThatThrownBy(() -> SupportedEmbeddingModel.fromName("word2vec"))
        .isInstanceOf(UnsupportedEmbeddingModelException.class)
        .hasMessageContaining("word2vec")
        .hasMessageContaining("Supported models: all-MiniLM-L6-v2");
    assertThatThrownBy(() -> SupportedEmbeddingModel.fromName(null))
        .isInstanceOf(UnsupportedEmbeddingModelException.class);
  }
}
