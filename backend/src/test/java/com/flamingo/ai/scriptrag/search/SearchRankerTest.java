package com.flamingo.ai.scriptrag.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.scriptrag.search.model.ResultType;
import com.flamingo.ai.scriptrag.search.model.SearchResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SearchRanker Tests")
class SearchRankerTest {

  private final SearchRanker ranker = new SearchRanker();

  private static SearchResult result(ResultType type, long id, String content, double score) {
    return SearchResult.builder().type(type).id(id).content(content).score(score).build();
  }

  @Nested
  @DisplayName("Composite score")
  class CompositeScore {

    @Test
    @DisplayName("Should weight by result type with a default for unlisted types")
    void shouldApplyTypeWeights() {
      assertThat(ranker.compositeScore(result(ResultType.SCENE, 1, "x", 0.5), "", false))
          .isEqualTo(0.5, within(1e-9));
      assertThat(ranker.compositeScore(result(ResultType.DIALOGUE, 1, "x", 0.5), "", false))
          .isEqualTo(0.45, within(1e-9));
      assertThat(ranker.compositeScore(result(ResultType.BIBLE_CHUNK, 1, "x", 0.5), "", false))
          .isEqualTo(0.25, within(1e-9));
    }

    @Test
    @DisplayName("Should clamp boosted scores to one")
    void shouldClampToOne() {
      SearchResult hit = result(ResultType.SCENE, 1, "coffee coffee", 1.0);

      assertThat(ranker.compositeScore(hit, "coffee", false)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should never go below zero")
    void shouldClampToZero() {
      assertThat(ranker.compositeScore(result(ResultType.SCENE, 1, "x", -3.0), "x", false))
          .isZero();
    }

    @Test
    @DisplayName("Should dampen later scripts when recency boosting is on")
    void shouldApplyRecency() {
      SearchResult hit =
          result(ResultType.SCENE, 1, "x", 0.5).toBuilder()
              .metadataEntry(SearchResult.SCRIPT_ORDER, 1000)
              .build();

      assertThat(ranker.compositeScore(hit, "", true)).isEqualTo(0.475, within(1e-9));
      assertThat(ranker.compositeScore(hit, "", false)).isEqualTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should keep recency inside its band for negative and extreme script orders")
    void shouldBoundRecency() {
      SearchResult unscored =
          result(ResultType.SCENE, 1, "x", 0.0).toBuilder()
              .metadataEntry(SearchResult.SCRIPT_ORDER, -1000)
              .build();
      SearchResult negative =
          result(ResultType.SCENE, 2, "x", 0.5).toBuilder()
              .metadataEntry(SearchResult.SCRIPT_ORDER, -500)
              .build();
      SearchResult late =
          result(ResultType.SCENE, 3, "x", 0.5).toBuilder()
              .metadataEntry(SearchResult.SCRIPT_ORDER, 1e12)
              .build();

      assertThat(ranker.compositeScore(unscored, "", true)).isZero();
      assertThat(ranker.compositeScore(negative, "", true)).isEqualTo(0.5, within(1e-9));
      assertThat(ranker.compositeScore(late, "", true)).isEqualTo(0.45, within(1e-6));
      assertThat(SearchRanker.recencyFactor(-500)).isEqualTo(1.0);
      assertThat(SearchRanker.recencyFactor(Double.NaN)).isEqualTo(1.0);
      assertThat(SearchRanker.recencyFactor(Double.POSITIVE_INFINITY)).isEqualTo(1.0);
      assertThat(SearchRanker.recencyFactor(0)).isEqualTo(1.0);
      assertThat(SearchRanker.recencyFactor(1e12)).isBetween(0.9, 1.0);
    }

    @Test
    @DisplayName("Should score a non-numeric base score as zero")
    void shouldNotReturnNaN() {
      assertThat(ranker.compositeScore(result(ResultType.SCENE, 1, "x", Double.NaN), "x", true))
          .isZero();
    }

    @Test
    @DisplayName("Should boost by query density, capped at one half")
    void shouldComputeDensityBoost() {
      String content = "needle" + " w".repeat(19);

      assertThat(ranker.densityBoost("needle", content)).isEqualTo(0.25, within(1e-9));
      assertThat(ranker.densityBoost("coffee", "coffee coffee")).isEqualTo(0.5);
      assertThat(ranker.densityBoost("", content)).isZero();
      assertThat(ranker.densityBoost("aa", "aaa")).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should boost metadata fields that contain the query")
    void shouldComputeMetadataBoost() {
      Map<String, Object> metadata =
          Map.of(
              SearchResult.CHARACTER, "JOHN",
              SearchResult.SCENE_HEADING, "INT. JOHN'S HOUSE",
              SearchResult.DESCRIPTION, "a kitchen");

      assertThat(ranker.metadataBoost("john", metadata)).isEqualTo(0.25, within(1e-9));
      assertThat(ranker.metadataBoost("kitchen", metadata)).isEqualTo(0.05, within(1e-9));
      assertThat(ranker.metadataBoost("john", Map.of())).isZero();
    }
  }

  @Nested
  @DisplayName("Ranking")
  class Ranking {

    @Test
    @DisplayName("Should sort by score and keep the best hit per type and id")
    void shouldSortAndDeduplicate() {
      List<SearchResult> ranked =
          ranker.rankResults(
              List.of(
                  result(ResultType.SCENE, 1, "x", 0.2),
                  result(ResultType.SCENE, 2, "x", 0.9),
                  result(ResultType.SCENE, 1, "x", 0.6),
                  result(ResultType.DIALOGUE, 1, "x", 0.6)),
              "",
              false);

      assertThat(ranked)
          .extracting(r -> r.getType() + ":" + r.getId())
          .containsExactly("SCENE:2", "SCENE:1", "DIALOGUE:1");
      assertThat(ranked.get(1).getScore()).isEqualTo(0.6, within(1e-9));
      assertThat(ranked).allSatisfy(r -> assertThat(r.getScore()).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Should keep input order for equal scores")
    void shouldBeStable() {
      List<SearchResult> input =
          List.of(
              result(ResultType.SCENE, 3, "x", 0.5),
              result(ResultType.SCENE, 1, "x", 0.5),
              result(ResultType.SCENE, 2, "x", 0.5));

      assertThat(ranker.rankResults(input, "", false))
          .extracting(SearchResult::getId)
          .containsExactly(3L, 1L, 2L);
    }

    @Test
    @DisplayName("Should give the same order and deduplication when ranking identical input twice")
    void shouldBeDeterministic() {
      List<SearchResult> input =
          List.of(
              result(ResultType.SCENE, 4, "x", 0.5),
              result(ResultType.DIALOGUE, 4, "x", 0.5),
              result(ResultType.SCENE, 2, "x", 0.5),
              result(ResultType.SCENE, 4, "x", 0.5),
              result(ResultType.ACTION, 9, "x", 0.7),
              result(ResultType.DIALOGUE, 4, "x", 0.3));

      List<SearchResult> first = ranker.rankResults(input, "x");
      List<SearchResult> second = ranker.rankResults(input, "x");

      assertThat(second)
          .extracting(r -> r.getType() + ":" + r.getId() + "=" + r.getScore())
          .containsExactlyElementsOf(
              first.stream().map(r -> r.getType() + ":" + r.getId() + "=" + r.getScore()).toList());
      assertThat(first)
          .extracting(r -> r.getType() + ":" + r.getId())
          .containsExactly("ACTION:9", "SCENE:4", "SCENE:2", "DIALOGUE:4");
    }

    @Test
    @DisplayName("Should return nothing for empty input")
    void shouldHandleEmpty() {
      assertThat(ranker.rankResults(List.of(), "q")).isEmpty();
      assertThat(ranker.rankResults(null, "q")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Filtering, grouping and merging")
  class Utilities {

    @Test
    @DisplayName("Should filter by minimum score and cap the result count")
    void shouldFilter() {
      List<SearchResult> results =
          List.of(
              result(ResultType.SCENE, 1, "x", 0.9),
              result(ResultType.SCENE, 1, "x", 0.8),
              result(ResultType.SCENE, 2, "x", 0.7),
              result(ResultType.SCENE, 3, "x", 0.1));

      assertThat(ranker.filterResults(results, 0.5, null, true))
          .extracting(SearchResult::getId)
          .containsExactly(1L, 2L);
      assertThat(ranker.filterResults(results, 0.5, 2, false))
          .extracting(SearchResult::getScore)
          .containsExactly(0.9, 0.8);
    }

    @Test
    @DisplayName("Should group by type in first-seen order")
    void shouldGroupByType() {
      Map<ResultType, List<SearchResult>> groups =
          ranker.groupResultsByType(
              List.of(
                  result(ResultType.DIALOGUE, 1, "x", 0.5),
                  result(ResultType.SCENE, 2, "x", 0.5),
                  result(ResultType.DIALOGUE, 3, "x", 0.5)));

      assertThat(groups.keySet()).containsExactly(ResultType.DIALOGUE, ResultType.SCENE);
      assertThat(groups.get(ResultType.DIALOGUE))
          .extracting(SearchResult::getId)
          .containsExactly(1L, 3L);
    }

    @Test
    @DisplayName("Should merge result sets by existing score without a query")
    void shouldMergeWithoutQuery() {
      List<SearchResult> merged =
          ranker.mergeResults(
              null,
              List.of(
                  List.of(result(ResultType.SCENE, 1, "x", 0.3)),
                  List.of(
                      result(ResultType.SCENE, 2, "x", 0.8),
                      result(ResultType.SCENE, 1, "x", 0.1))));

      assertThat(merged).extracting(SearchResult::getId).containsExactly(2L, 1L);
      assertThat(merged.get(1).getScore()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("Should re-rank merged sets when a query is given")
    void shouldMergeWithQuery() {
      List<SearchResult> merged =
          ranker.mergeResults(
              "coffee",
              List.of(
                  List.of(result(ResultType.SCENE, 1, "tea time", 0.5)),
                  List.of(result(ResultType.SCENE, 2, "coffee time", 0.5))));

      assertThat(merged).extracting(SearchResult::getId).containsExactly(2L, 1L);
    }
  }
}
