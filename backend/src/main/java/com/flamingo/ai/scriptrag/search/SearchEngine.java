package com.flamingo.ai.scriptrag.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.scriptrag.config.ScriptragProperties;
import com.flamingo.ai.scriptrag.exception.SearchException;
import com.flamingo.ai.scriptrag.search.model.ResultType;
import com.flamingo.ai.scriptrag.search.model.SearchMode;
import com.flamingo.ai.scriptrag.search.model.SearchQuery;
import com.flamingo.ai.scriptrag.search.model.SearchResponse;
import com.flamingo.ai.scriptrag.search.model.SearchResult;
import com.flamingo.ai.scriptrag.search.query.QueryBuilder;
import com.flamingo.ai.scriptrag.search.query.SqlQuery;
import com.flamingo.ai.scriptrag.search.semantic.SemanticEnhancement;
import com.flamingo.ai.scriptrag.search.semantic.SemanticSearchAdapter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Hybrid search over the script database.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>SQL page and count for scenes, unless the query is bible-only
 *   <li>SQL page and count for bible chunks when requested; failures here yield no bible hits
 *   <li>semantic enhancement when the query mode calls for it; failures keep the SQL results
 * </ol>
 *
 * All reads go through a read-only connection.
 */
@Service
@Slf4j
public class SearchEngine {

  static final String SQL_METHOD = "sql";
  static final String SEMANTIC_METHOD = "semantic";

  private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final QueryBuilder queryBuilder;
  private final SemanticSearchAdapter semanticAdapter;
  private final ScriptragProperties properties;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final Executor searchExecutor;

  public SearchEngine(
      @Qualifier("readOnlyJdbcTemplate") JdbcTemplate jdbcTemplate,
      QueryBuilder queryBuilder,
      SemanticSearchAdapter semanticAdapter,
      ScriptragProperties properties,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.jdbcTemplate = jdbcTemplate;
    this.queryBuilder = queryBuilder;
    this.semanticAdapter = semanticAdapter;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Runs a search. Never fails for an empty result or a semantic-layer problem.
   *
   * @throws SearchException if the scene query cannot be executed
   */
  @Timed(value = "search.duration", description = "Time taken to execute a script search")
  public SearchResponse search(SearchQuery query) {
    long start = System.nanoTime();
    meterRegistry.counter("search.requests").increment();

    List<SearchResult> results = new ArrayList<>();
    int pageSize = 0;
    int totalCount = 0;
    if (!query.isOnlyBible()) {
      List<Map<String, Object>> rows = queryRows(queryBuilder.buildSearchQuery(query));
      pageSize = rows.size();
      totalCount = queryCount(queryBuilder.buildCountQuery(query));
      String matchType = determineMatchType(query);
      for (Map<String, Object> row : rows) {
        results.add(toSceneResult(row, matchType));
      }
    }

    List<SearchResult> bibleResults = new ArrayList<>();
    int biblePageSize = 0;
    int bibleTotalCount = 0;
    if (query.searchesBible()) {
      try {
        List<Map<String, Object>> rows = queryRows(queryBuilder.buildBibleSearchQuery(query));
        biblePageSize = rows.size();
        bibleTotalCount = queryCount(queryBuilder.buildBibleCountQuery(query));
        for (Map<String, Object> row : rows) {
          bibleResults.add(toBibleResult(row));
        }
      } catch (RuntimeException e) {
        log.error(
            "Bible search failed for query '{}': {}",
            abbreviate(query.getRawQuery()),
            e.getMessage());
        bibleResults.clear();
        biblePageSize = 0;
        bibleTotalCount = 0;
      }
    }

    List<String> searchMethods = new ArrayList<>(List.of(SQL_METHOD));
    if (needsSemanticSearch(query)) {
      searchMethods.add(SEMANTIC_METHOD);
      int semanticLimit = semanticLimit(query.getLimit());
      log.info("Enhancing results with semantic search (limit {})", semanticLimit);
      try {
        SemanticEnhancement enhancement = semanticAdapter.enhance(query, results, semanticLimit);
        results = new ArrayList<>(enhancement.results());
        mergeBibleResults(bibleResults, enhancement.bibleResults());
      } catch (RuntimeException e) {
        meterRegistry.counter("search.semantic.fallback").increment();
        log.error(
            "Semantic search failed, falling back to SQL results for query '{}': {}",
            abbreviate(query.getRawQuery()),
            e.getMessage(),
            e);
      }
    }

    boolean hasMore =
        query.isOnlyBible()
            ? query.getOffset() + biblePageSize < bibleTotalCount
            : query.getOffset() + pageSize < totalCount;
    double executionTimeMs = (System.nanoTime() - start) / 1_000_000.0;

    SearchResponse response =
        SearchResponse.builder()
            .query(query)
            .results(results)
            .bibleResults(bibleResults)
            .totalCount(totalCount)
            .bibleTotalCount(bibleTotalCount)
            .hasMore(hasMore)
            .executionTimeMs(executionTimeMs)
            .searchMethods(searchMethods)
            .build();
    log.info(
        "Search completed: {} results (scenes: {}, bible: {}) in {} ms",
        response.totalResults(),
        results.size(),
        bibleResults.size(),
        String.format("%.2f", executionTimeMs));
    return response;
  }

  /** Runs {@link #search} on the search executor. */
  public CompletableFuture<SearchResponse> searchAsync(SearchQuery query) {
    return CompletableFuture.supplyAsync(() -> search(query), searchExecutor);
  }

  boolean needsSemanticSearch(SearchQuery query) {
    SearchMode mode = query.getMode();
    if (mode == SearchMode.STRICT) {
      return false;
    }
    if (mode == SearchMode.FUZZY) {
      return true;
    }
    return query.getSemanticWordCount() >= properties.getSearch().getVectorThreshold();
  }

  int semanticLimit(int requestedLimit) {
    ScriptragProperties.Search search = properties.getSearch();
    return Math.max(
        search.getVectorMinResults(),
        (int) Math.round(requestedLimit * search.getVectorResultLimitFactor()));
  }

  static String determineMatchType(SearchQuery query) {
    if (hasText(query.getDialogue())) {
      return "dialogue";
    }
    if (hasText(query.getAction())) {
      return "action";
    }
    if (!query.getCharacters().isEmpty()) {
      return "character";
    }
    if (!query.getLocations().isEmpty()) {
      return "location";
    }
    return "text";
  }

  private List<Map<String, Object>> queryRows(SqlQuery sql) {
    log.debug("Executing search query: {}", abbreviate(sql.sql()));
    try {
      return jdbcTemplate.queryForList(sql.sql(), sql.paramArray());
    } catch (DataAccessException e) {
      throw new SearchException("Search query failed: " + e.getMessage(), e);
    }
  }

  private int queryCount(SqlQuery sql) {
    List<Map<String, Object>> rows;
    try {
      rows = jdbcTemplate.queryForList(sql.sql(), sql.paramArray());
    } catch (DataAccessException e) {
      throw new SearchException("Count query failed: " + e.getMessage(), e);
    }
    if (rows == null || rows.isEmpty()) {
      return 0;
    }
    Object total = rows.get(0).get("total");
    if (total instanceof Number number) {
      return number.intValue();
    }
    log.warn("Count query returned no usable total: {}", total);
    return 0;
  }

  private SearchResult toSceneResult(Map<String, Object> row, String matchType) {
    Map<String, Object> scriptMetadata = parseScriptMetadata(row);
    SearchResult.SearchResultBuilder builder =
        SearchResult.builder()
            .type(ResultType.SCENE)
            .id(asLong(row.get("scene_id")))
            .content(row.get("scene_content") == null ? "" : row.get("scene_content").toString())
            .score(1.0);
    putIfPresent(builder, SearchResult.SCRIPT_ID, row.get("script_id"));
    putIfPresent(builder, SearchResult.SCRIPT_TITLE, row.get("script_title"));
    putIfPresent(builder, "script_author", row.get("script_author"));
    putIfPresent(builder, "scene_number", row.get("scene_number"));
    putIfPresent(builder, SearchResult.SCENE_HEADING, row.get("scene_heading"));
    putIfPresent(builder, "scene_location", row.get("scene_location"));
    putIfPresent(builder, "scene_time", row.get("scene_time"));
    putIfPresent(builder, "season", scriptMetadata.get("season"));
    putIfPresent(builder, "episode", scriptMetadata.get("episode"));
    return builder.metadataEntry(SearchResult.MATCH_TYPE, matchType).build();
  }

  private SearchResult toBibleResult(Map<String, Object> row) {
    SearchResult.SearchResultBuilder builder =
        SearchResult.builder()
            .type(ResultType.BIBLE_CHUNK)
            .id(asLong(row.get("chunk_id")))
            .content(row.get("chunk_content") == null ? "" : row.get("chunk_content").toString())
            .score(1.0);
    putIfPresent(builder, SearchResult.SCRIPT_ID, row.get("script_id"));
    putIfPresent(builder, SearchResult.SCRIPT_TITLE, row.get("script_title"));
    putIfPresent(builder, "bible_id", row.get("bible_id"));
    putIfPresent(builder, "bible_title", row.get("bible_title"));
    putIfPresent(builder, "chunk_heading", row.get("chunk_heading"));
    putIfPresent(builder, "chunk_level", row.get("chunk_level"));
    return builder.metadataEntry(SearchResult.MATCH_TYPE, "text").build();
  }

  private Map<String, Object> parseScriptMetadata(Map<String, Object> row) {
    Object raw = row.get("script_metadata");
    if (raw == null || raw.toString().isBlank()) {
      return Map.of();
    }
    try {
      Map<String, Object> parsed = objectMapper.readValue(raw.toString(), JSON_MAP);
      return parsed == null ? Map.of() : parsed;
    } catch (JsonProcessingException e) {
      log.warn("Failed to parse metadata for script {}: {}", row.get("script_id"), e.getMessage());
      return Map.of();
    }
  }

  private static void mergeBibleResults(List<SearchResult> target, List<SearchResult> additions) {
    Set<Long> seen = new HashSet<>();
    target.forEach(r -> seen.add(r.getId()));
    for (SearchResult addition : additions) {
      if (seen.add(addition.getId())) {
        target.add(addition);
      }
    }
  }

  private static void putIfPresent(
      SearchResult.SearchResultBuilder builder, String key, Object value) {
    if (value != null) {
      builder.metadataEntry(key, value);
    }
  }

  private static long asLong(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    return Long.parseLong(String.valueOf(value));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= 200 ? text : text.substring(0, 200) + "...";
  }
}
