package com.flamingo.ai.researchcache.service.embedding;

import com.flamingo.ai.researchcache.config.ResearchCacheProperties;
import com.flamingo.ai.researchcache.exception.DimensionMismatchException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns chunk text and queries into fixed-width vectors using the configured LangChain4j model.
 *
 * <p>Every vector is checked against the catalog dimension of {@link SupportedEmbeddingModel}, so a
 * misconfigured backend fails here rather than polluting the index with vectors of another width.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorEmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final SupportedEmbeddingModel modelSpec;
  private final ResearchCacheProperties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds document chunks in batches of {@code research-cache.embedding.batch-size}.
   *
   * @param texts chunk texts, in order
   * @return one vector per input text, in the same order
   */
  @Timed(value = "embedding.embedDocuments", description = "Time to embed document chunks")
  @Retry(name = "embedding")
  public List<float[]> embedDocuments(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    int batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int start = 0; start < texts.size(); start += batchSize) {
      List<TextSegment> batch =
          texts.subList(start, Math.min(start + batchSize, texts.size())).stream()
              .map(TextSegment::from)
              .toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(batch);
      List<Embedding> embeddings = response.content();
      if (embeddings.size() != batch.size()) {
        throw new IllegalStateException(
            "Embedding backend returned "
                + embeddings.size()
                + " vectors for a batch of "
                + batch.size());
      }
      for (Embedding embedding : embeddings) {
        vectors.add(checkDimension(embedding.vector()));
      }
      log.debug(
          "Embedded batch of {} chunks ({} / {})", batch.size(), vectors.size(), texts.size());
    }
    meterRegistry.counter("embedding.requests.success", "type", "documents").increment();
    return vectors;
  }

  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @Retry(name = "embedding")
  public float[] embedQuery(String query) {
    log.debug("Embedding query of {} chars", query.length());
    Response<Embedding> response = embeddingModel.embed(query);
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return checkDimension(response.content().vector());
  }

  public int dimension() {
    return modelSpec.dimension();
  }

  public String modelName() {
    return modelSpec.modelName();
  }

  private float[] checkDimension(float[] vector) {
    if (vector.length != modelSpec.dimension()) {
      meterRegistry.counter("embedding.requests.failure", "reason", "dimension").increment();
      throw new DimensionMismatchException(
          modelSpec.dimension(), vector.length, "embedding backend for " + modelSpec.modelName());
    }
    return vector;
  }
}
