package com.flamingo.ai.researchcache.exception;

/** Exception thrown at startup when the configured embedding model name is not in the catalog. */
public class UnsupportedEmbeddingModelException extends RuntimeException {

  private final String modelName;

  public UnsupportedEmbeddingModelException(String modelName, String supported) {
    super("Unsupported embedding model '" + modelName + "'. Supported models: " + supported);
    this.modelName = modelName;
  }

  public String getModelName() {
    return modelName;
  }
}
