package com.flamingo.ai.scriptrag.search.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/** One scored hit. Scores are within {@code [0, 1]}. */
@Getter
@Builder(toBuilder = true)
public class SearchResult {

  // Metadata keys shared by producers and the ranker.
  public static final String SCRIPT_ID = "script_id";
  public static final String SCRIPT_TITLE = "script_title";
  public static final String SCENE_HEADING = "scene_heading";
  public static final String CHARACTER = "character";
  public static final String DESCRIPTION = "description";
  public static final String SCRIPT_ORDER = "script_order";
  public static final String MATCH_TYPE = "match_type";

  private final ResultType type;
  private final long id;
  private final String content;
  private final double score;
  @Singular("metadataEntry") private final Map<String, Object> metadata;
  @Singular private final List<String> highlights;

  public SearchResult withScore(double newScore) {
    return toBuilder().score(newScore).build();
  }

  public String getMatchType() {
    Object matchType = metadata.get(MATCH_TYPE);
    return matchType == null ? null : matchType.toString();
  }
}
