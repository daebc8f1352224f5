package com.flamingo.ai.scriptrag.search.semantic;

import com.flamingo.ai.scriptrag.search.model.SearchResult;
import java.util.List;

/**
 * Result of semantic enhancement.
 *
 * @param results the existing scene hits followed by any semantic additions
 * @param bibleResults bible chunk hits found by similarity
 */
public record SemanticEnhancement(List<SearchResult> results, List<SearchResult> bibleResults) {

  public SemanticEnhancement {
    results = List.copyOf(results);
    bibleResults = List.copyOf(bibleResults);
  }
}
