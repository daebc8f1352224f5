package com.flamingo.ai.scriptrag.config;

import com.flamingo.ai.scriptrag.embedding.cache.InvalidationStrategy;
import com.flamingo.ai.scriptrag.embedding.preprocess.PreprocessingStep;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the embedding pipeline, vector storage and search. */
@Configuration
@ConfigurationProperties(prefix = "scriptrag")
@Getter
@Setter
public class ScriptragProperties {

  private Embedding embedding = new Embedding();
  private Cache cache = new Cache();
  private Storage storage = new Storage();
  private Search search = new Search();

  @Getter
  @Setter
  public static class Embedding {
    private String model = "text-embedding-3-small";

    /** Requested output dimensions; {@code null} lets the provider pick its default. */
    private Integer dimensions;

    /** Ordered preprocessing steps. Empty means whitespace cleanup and unicode normalization. */
    private List<PreprocessingStep> preprocessingSteps = new ArrayList<>();

    private int maxTextLength = 8000;

    /** Characters per chunk window; 0 disables chunking. */
    private int chunkSize = 1000;

    private int chunkOverlap = 200;
    private int batchSize = 10;
    private int maxConcurrentBatches = 3;
    private boolean useCache = true;
  }

  @Getter
  @Setter
  public static class Cache {
    private InvalidationStrategy strategy = InvalidationStrategy.LRU;
    private int maxSize = 10_000;
    private Duration ttl = Duration.ofDays(30);
  }

  @Getter
  @Setter
  public static class Storage {
    /** Root directory of the file-backed vector store. */
    private String rootPath = ".embeddings";

    private String extension = "emb";

    /** Tracking-attributes marker created once in the storage root. */
    private String markerFileName = ".gitattributes";

    /** Hard cap on decoded dimensions; guards against corrupted length fields. */
    private int maxDimension = 10_000;

    /** Whether the hybrid store mirrors writes to the file store. */
    private boolean secondaryEnabled = true;
  }

  @Getter
  @Setter
  public static class Search {
    /** Word count at which AUTO mode adds semantic search. */
    private int vectorThreshold = 10;

    private double vectorSimilarityThreshold = 0.3;
    private double vectorResultLimitFactor = 0.5;
    private int vectorMinResults = 5;
  }
}
