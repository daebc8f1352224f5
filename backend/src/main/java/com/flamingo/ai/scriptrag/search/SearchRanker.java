package com.flamingo.ai.scriptrag.search;

import com.flamingo.ai.scriptrag.search.model.ResultType;
import com.flamingo.ai.scriptrag.search.model.SearchResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Relevance scoring for heterogeneous search hits.
 *
 * <p>Composite score:
 *
 * <pre>
 * base * typeWeight * (1 + densityBoost) * exactMatchBoost * (1 + metadataBoost) * recency
 * </pre>
 *
 * clamped to {@code [0, 1]}. Ranking is deterministic: equal scores keep their input order.
 */
@Component
@Slf4j
public class SearchRanker {

  private static final double DEFAULT_TYPE_WEIGHT = 0.5;
  private static final double MAX_DENSITY_BOOST = 0.5;
  private static final double EXACT_MATCH_BOOST = 1.2;

  private static final Comparator<SearchResult> BY_SCORE_DESC =
      Comparator.comparingDouble(SearchResult::getScore).reversed();

  private final Map<ResultType, Double> typeWeights = new EnumMap<>(ResultType.class);

  public SearchRanker() {
    typeWeights.put(ResultType.SCENE, 1.0);
    typeWeights.put(ResultType.DIALOGUE, 0.9);
    typeWeights.put(ResultType.CHARACTER, 0.85);
    typeWeights.put(ResultType.ACTION, 0.8);
    typeWeights.put(ResultType.LOCATION, 0.75);
    typeWeights.put(ResultType.OBJECT, 0.7);
  }

  /** Rescores, sorts by score descending and keeps the first hit per (type, id). */
  public List<SearchResult> rankResults(List<SearchResult> results, String query) {
    return rankResults(results, query, true);
  }

  public List<SearchResult> rankResults(
      List<SearchResult> results, String query, boolean boostRecent) {
    if (results == null || results.isEmpty()) {
      return List.of();
    }
    List<SearchResult> scored = new ArrayList<>(results.size());
    for (SearchResult result : results) {
      scored.add(result.withScore(compositeScore(result, query, boostRecent)));
    }
    scored.sort(BY_SCORE_DESC);
    List<SearchResult> ranked = deduplicate(scored);
    log.debug("Ranked {} results into {} unique hits", results.size(), ranked.size());
    return ranked;
  }

  /**
   * Keeps hits scoring at least {@code minScore}, optionally deduplicated and truncated.
   *
   * @param maxResults cap on returned hits, or null for no cap
   */
  public List<SearchResult> filterResults(
      List<SearchResult> results, double minScore, Integer maxResults, boolean deduplicate) {
    List<SearchResult> filtered =
        results.stream().filter(r -> r.getScore() >= minScore).collect(Collectors.toList());
    if (deduplicate) {
      filtered = deduplicate(filtered);
    }
    if (maxResults != null && filtered.size() > maxResults) {
      filtered = new ArrayList<>(filtered.subList(0, maxResults));
    }
    return filtered;
  }

  /** Groups by type in first-seen order, keeping input order inside each group. */
  public Map<ResultType, List<SearchResult>> groupResultsByType(List<SearchResult> results) {
    return results.stream()
        .collect(
            Collectors.groupingBy(
                SearchResult::getType, LinkedHashMap::new, Collectors.toList()));
  }

  /**
   * Merges result sets. With a query the union is re-ranked; otherwise it is sorted by existing
   * score and deduplicated.
   */
  public List<SearchResult> mergeResults(String query, List<List<SearchResult>> resultSets) {
    List<SearchResult> all = new ArrayList<>();
    resultSets.forEach(all::addAll);
    if (query != null && !query.isEmpty()) {
      return rankResults(all, query);
    }
    all.sort(BY_SCORE_DESC);
    return deduplicate(all);
  }

  double compositeScore(SearchResult result, String query, boolean boostRecent) {
    String content = result.getContent();
    double score =
        result.getScore() * typeWeights.getOrDefault(result.getType(), DEFAULT_TYPE_WEIGHT);
    score *= 1.0 + densityBoost(query, content);
    if (hasExactMatch(query, content)) {
      score *= EXACT_MATCH_BOOST;
    }
    score *= 1.0 + metadataBoost(query, result.getMetadata());

    Object order = result.getMetadata().get(SearchResult.SCRIPT_ORDER);
    if (boostRecent && order instanceof Number number) {
      score *= recencyFactor(number.doubleValue());
    }
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  /** Between 0.9 and 1.0, highest for early script order; 1.0 for unusable orders. */
  static double recencyFactor(double order) {
    if (!Double.isFinite(order) || order < 0) {
      return 1.0;
    }
    double recency = 1.0 / (1.0 + order / 1000.0);
    return 0.9 + 0.1 * recency;
  }

  double densityBoost(String query, String content) {
    if (isEmpty(query) || isEmpty(content)) {
      return 0.0;
    }
    String contentLower = content.toLowerCase(Locale.ROOT);
    String stripped = contentLower.strip();
    int contentWords = stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    if (contentWords == 0) {
      return 0.0;
    }
    int occurrences = 0;
    for (String word : query.toLowerCase(Locale.ROOT).strip().split("\\s+")) {
      occurrences += countOccurrences(contentLower, word);
    }
    return Math.min(MAX_DENSITY_BOOST, 5.0 * occurrences / contentWords);
  }

  double metadataBoost(String query, Map<String, Object> metadata) {
    if (isEmpty(query) || metadata.isEmpty()) {
      return 0.0;
    }
    String queryLower = query.toLowerCase(Locale.ROOT);
    double boost = 0.0;
    if (fieldContains(metadata, SearchResult.CHARACTER, queryLower)) {
      boost += 0.15;
    }
    if (fieldContains(metadata, SearchResult.SCENE_HEADING, queryLower)) {
      boost += 0.10;
    }
    if (fieldContains(metadata, SearchResult.DESCRIPTION, queryLower)) {
      boost += 0.05;
    }
    return boost;
  }

  private static boolean hasExactMatch(String query, String content) {
    return !isEmpty(query)
        && !isEmpty(content)
        && content.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
  }

  private static boolean fieldContains(Map<String, Object> metadata, String key, String needle) {
    Object value = metadata.get(key);
    return value != null && String.valueOf(value).toLowerCase(Locale.ROOT).contains(needle);
  }

  // Non-overlapping substring occurrences.
  private static int countOccurrences(String haystack, String needle) {
    if (needle.isEmpty()) {
      return 0;
    }
    int count = 0;
    int from = 0;
    while ((from = haystack.indexOf(needle, from)) >= 0) {
      count++;
      from += needle.length();
    }
    return count;
  }

  private static List<SearchResult> deduplicate(List<SearchResult> results) {
    Set<String> seen = new HashSet<>();
    List<SearchResult> unique = new ArrayList<>();
    for (SearchResult result : results) {
      if (seen.add(result.getType() + ":" + result.getId())) {
        unique.add(result);
      }
    }
    return unique;
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }
}
