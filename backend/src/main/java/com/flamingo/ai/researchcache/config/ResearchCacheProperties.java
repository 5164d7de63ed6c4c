package com.flamingo.ai.researchcache.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the local cache, chunking and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "research-cache")
@Getter
@Setter
public class ResearchCacheProperties {

  /** Root directory holding one sub-directory (database + attachment blobs) per collection. */
  private String cacheDir =
      Paths.get(System.getProperty("user.home"), ".research-cache").toString();

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Sync sync = new Sync();
  private Pipeline pipeline = new Pipeline();
  private Source source = new Source();

  public Path cacheRoot() {
    return Paths.get(cacheDir);
  }

  @Getter
  @Setter
  public static class Chunking {
    private int size = 512;
    private int overlap = 50;
    private int minSize = 100;
  }

  @Getter
  @Setter
  public static class Embedding {
    private String modelName = "all-MiniLM-L6-v2";
    private int batchSize = 32;

    /** Only needed for the OpenAI-hosted models. */
    private String openaiApiKey = "";

    private int timeoutSeconds = 30;

    /** Model and tokenizer files for catalog models that are not bundled in a jar. */
    private String onnxModelPath;

    private String onnxTokenizerPath;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 20;

    /** Chunk hits fetched per requested source during discovery. */
    private int discoveryMultiplier = 5;

    private double maxSimilarityWeight = 0.7; // remaining weight goes to the mean
    private int excerptLength = 200;
    private int maxExcerpts = 3;
  }

  @Getter
  @Setter
  public static class Sync {
    private boolean includeSubcollections = true;
  }

  /** Zotero Web API access. */
  @Getter
  @Setter
  public static class Source {
    private String baseUrl = "https://api.zotero.org";

    /** {@code user} or {@code group}. */
    private String libraryType = "user";

    private String libraryId = "";
    private String apiKey = "";
    private int pageSize = 100;
    private int timeoutSeconds = 60;
    private int maxDownloadMb = 200;
  }

  @Getter
  @Setter
  public static class Pipeline {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 50;
  }
}
