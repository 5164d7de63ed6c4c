package com.flamingo.ai.researchcache.service.embedding;

import com.flamingo.ai.researchcache.exception.UnsupportedEmbeddingModelException;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Catalog of embedding models the cache can index with. The dimension is fixed per model name, so
 * stored vectors can be decoded without a length prefix.
 */
public enum SupportedEmbeddingModel {
  ALL_MINILM_L6_V2("all-MiniLM-L6-v2", 384, Backend.BUNDLED_ONNX),
  BGE_SMALL_EN_V15("bge-small-en-v1.5", 384, Backend.BUNDLED_ONNX),
  ALL_MPNET_BASE_V2("all-mpnet-base-v2", 768, Backend.ONNX_FILE),
  BGE_BASE_EN_V15("bge-base-en-v1.5", 768, Backend.ONNX_FILE),
  TEXT_EMBEDDING_3_SMALL("text-embedding-3-small", 1536, Backend.OPENAI),
  TEXT_EMBEDDING_3_LARGE("text-embedding-3-large", 3072, Backend.OPENAI);

  /** Where the model runs. */
  public enum Backend {
    /** In-process ONNX model shipped inside a LangChain4j artifact. */
    BUNDLED_ONNX,
    /** In-process ONNX model loaded from user-supplied model and tokenizer files. */
    ONNX_FILE,
    OPENAI
  }

  private final String modelName;
  private final int dimension;
  private final Backend backend;

  SupportedEmbeddingModel(String modelName, int dimension, Backend backend) {
    this.modelName = modelName;
    this.dimension = dimension;
    this.backend = backend;
  }

  public String modelName() {
    return modelName;
  }

  public int dimension() {
    return dimension;
  }

  public Backend backend() {
    return backend;
  }

  /**
   * Resolves a configured model name. Matching ignores case.
   *
   * @throws UnsupportedEmbeddingModelException if the name is not in the catalog
   */
  public static SupportedEmbeddingModel fromName(String name) {
    if (name != null) {
      for (SupportedEmbeddingModel model : values()) {
        if (model.modelName.equalsIgnoreCase(name.trim())) {
          return model;
        }
      }
    }
    throw new UnsupportedEmbeddingModelException(name, supportedNames());
  }

  public static String supportedNames() {
    return Arrays.stream(values())
        .map(SupportedEmbeddingModel::modelName)
        .collect(Collectors.joining(", "));
  }
}
