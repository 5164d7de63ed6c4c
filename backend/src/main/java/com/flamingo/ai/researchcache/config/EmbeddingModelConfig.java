package com.flamingo.ai.researchcache.config;

import com.flamingo.ai.researchcache.service.embedding.SupportedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.OnnxEmbeddingModel;
import dev.langchain4j.model.embedding.onnx.PoolingMode;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15.BgeSmallEnV15EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the LangChain4j embedding model selected by {@code
 * research-cache.embedding.model-name}.
 */
@Configuration
@Slf4j
public class EmbeddingModelConfig {

  @Bean
  public SupportedEmbeddingModel embeddingModelSpec(ResearchCacheProperties properties) {
    return SupportedEmbeddingModel.fromName(properties.getEmbedding().getModelName());
  }

  @Bean
  public EmbeddingModel embeddingModel(
      SupportedEmbeddingModel spec, ResearchCacheProperties properties) {
    ResearchCacheProperties.Embedding embedding = properties.getEmbedding();
    log.info("Using embedding model {} ({} dimensions)", spec.modelName(), spec.dimension());

    return switch (spec) {
      case ALL_MINILM_L6_V2 -> new AllMiniLmL6V2EmbeddingModel();
      case BGE_SMALL_EN_V15 -> new BgeSmallEnV15EmbeddingModel();
      case ALL_MPNET_BASE_V2 -> onnxFromFiles(embedding, PoolingMode.MEAN);
      case BGE_BASE_EN_V15 -> onnxFromFiles(embedding, PoolingMode.CLS);
      case TEXT_EMBEDDING_3_SMALL, TEXT_EMBEDDING_3_LARGE -> openAi(spec, embedding);
    };
  }

  private EmbeddingModel onnxFromFiles(
      ResearchCacheProperties.Embedding embedding, PoolingMode poolingMode) {
    if (isBlank(embedding.getOnnxModelPath()) || isBlank(embedding.getOnnxTokenizerPath())) {
      throw new IllegalStateException(
          "Model "
              + embedding.getModelName()
              + " needs research-cache.embedding.onnx-model-path and onnx-tokenizer-path.");
    }
    return new OnnxEmbeddingModel(
        embedding.getOnnxModelPath(), embedding.getOnnxTokenizerPath(), poolingMode);
  }

  private EmbeddingModel openAi(
      SupportedEmbeddingModel spec, ResearchCacheProperties.Embedding embedding) {
    if (isBlank(embedding.getOpenaiApiKey())) {
      throw new IllegalStateException(
          "OpenAI API key is required for "
              + spec.modelName()
              + ". Set OPENAI_API_KEY environment variable.");
    }
    return OpenAiEmbeddingModel.builder()
        .apiKey(embedding.getOpenaiApiKey())
        .modelName(spec.modelName())
        .dimensions(spec.dimension())
        .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
        .build();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
