package com.flamingo.ai.scriptrag.search.semantic;

import com.flamingo.ai.scriptrag.search.model.SearchQuery;
import com.flamingo.ai.scriptrag.search.model.SearchResult;
import java.util.List;

/** Adds similarity-based hits to the results of a structural search. */
public interface SemanticSearchAdapter {

  /**
   * @param query the search being answered
   * @param existingResults scene hits already found, kept first and in order
   * @param limit maximum number of scene hits to add
   * @throws com.flamingo.ai.scriptrag.exception.SemanticSearchException if embedding or vector
   *     lookup fails
   */
  SemanticEnhancement enhance(SearchQuery query, List<SearchResult> existingResults, int limit);
}
