package com.flamingo.ai.scriptrag.search.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/** Page of scene hits and bible chunk hits for one query. */
@Getter
@Builder
public class SearchResponse {

  private final SearchQuery query;
  @Singular private final List<SearchResult> results;
  @Singular private final List<SearchResult> bibleResults;

  /** Scene matches across all pages. */
  private final int totalCount;

  private final int bibleTotalCount;
  private final boolean hasMore;
  private final double executionTimeMs;
  @Singular private final List<String> searchMethods;

  public int totalResults() {
    return results.size() + bibleResults.size();
  }
}
