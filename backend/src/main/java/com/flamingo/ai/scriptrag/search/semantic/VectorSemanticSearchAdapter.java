package com.flamingo.ai.scriptrag.search.semantic;

import com.flamingo.ai.scriptrag.config.ScriptragProperties;
import com.flamingo.ai.scriptrag.embedding.pipeline.EmbeddingPipeline;
import com.flamingo.ai.scriptrag.embedding.store.VectorMatch;
import com.flamingo.ai.scriptrag.embedding.store.VectorStore;
import com.flamingo.ai.scriptrag.exception.SemanticSearchException;
import com.flamingo.ai.scriptrag.search.SearchRanker;
import com.flamingo.ai.scriptrag.search.model.ResultType;
import com.flamingo.ai.scriptrag.search.model.SearchQuery;
import com.flamingo.ai.scriptrag.search.model.SearchResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Semantic enhancement backed by the embedding pipeline and a searchable {@link VectorStore}.
 *
 * <p>Scene vectors are stored under entity type {@value #SCENE_ENTITY} and bible chunk vectors
 * under {@value #BIBLE_CHUNK_ENTITY}; their metadata carries the display fields ({@code
 * content}, {@code scene_heading}, ...).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorSemanticSearchAdapter implements SemanticSearchAdapter {

  public static final String SCENE_ENTITY = "scene";
  public static final String BIBLE_CHUNK_ENTITY = "bible_chunk";
  public static final String CONTENT = "content";
  public static final String SEMANTIC_MATCH = "semantic";

  private final EmbeddingPipeline embeddingPipeline;
  private final VectorStore vectorStore;
  private final SearchRanker searchRanker;
  private final ScriptragProperties properties;

  @Override
  public SemanticEnhancement enhance(
      SearchQuery query, List<SearchResult> existingResults, int limit) {
    String queryText = query.getSemanticText();
    if (queryText.isEmpty()) {
      return new SemanticEnhancement(existingResults, List.of());
    }
    if (!vectorStore.supportsSearch()) {
      log.debug("Vector store does not support similarity search, skipping enhancement");
      return new SemanticEnhancement(existingResults, List.of());
    }

    String model = embeddingPipeline.getModel();
    double threshold = properties.getSearch().getVectorSimilarityThreshold();
    List<VectorMatch> sceneMatches;
    List<VectorMatch> bibleMatches = List.of();
    try {
      float[] queryVector = embeddingPipeline.generateEmbedding(queryText);
      sceneMatches =
          vectorStore.search(queryVector, SCENE_ENTITY, model, limit * 2, threshold, null);
      if (query.searchesBible()) {
        bibleMatches =
            vectorStore.search(queryVector, BIBLE_CHUNK_ENTITY, model, limit, threshold, null);
      }
    } catch (RuntimeException e) {
      throw new SemanticSearchException("Semantic search failed: " + e.getMessage(), e);
    }

    Set<Long> existingIds = new HashSet<>();
    existingResults.forEach(r -> existingIds.add(r.getId()));

    List<SearchResult> candidates = new ArrayList<>();
    for (VectorMatch match : sceneMatches) {
      if (!existingIds.contains(match.entityId())) {
        candidates.add(toResult(ResultType.SCENE, match));
      }
    }

    List<SearchResult> combined = new ArrayList<>(existingResults);
    int added = 0;
    for (SearchResult candidate : searchRanker.rankResults(candidates, queryText)) {
      if (added >= limit) {
        break;
      }
      if (existingIds.add(candidate.getId())) {
        combined.add(candidate);
        added++;
      }
    }

    List<SearchResult> bibleResults = new ArrayList<>(bibleMatches.size());
    for (VectorMatch match : bibleMatches) {
      bibleResults.add(toResult(ResultType.BIBLE_CHUNK, match));
    }

    log.info(
        "Added {} semantic scene results and {} bible results", added, bibleResults.size());
    return new SemanticEnhancement(combined, bibleResults);
  }

  private static SearchResult toResult(ResultType type, VectorMatch match) {
    SearchResult.SearchResultBuilder builder =
        SearchResult.builder()
            .type(type)
            .id(match.entityId())
            .content(String.valueOf(match.metadata().getOrDefault(CONTENT, "")))
            .score(Math.max(0.0, Math.min(1.0, match.score())));
    for (Map.Entry<String, Object> entry : match.metadata().entrySet()) {
      if (!CONTENT.equals(entry.getKey()) && entry.getValue() != null) {
        builder.metadataEntry(entry.getKey(), entry.getValue());
      }
    }
    return builder.metadataEntry(SearchResult.MATCH_TYPE, SEMANTIC_MATCH).build();
  }
}
