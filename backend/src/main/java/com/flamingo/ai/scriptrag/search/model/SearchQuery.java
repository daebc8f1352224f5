package com.flamingo.ai.scriptrag.search.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/** Parsed search request. Built once per call and not modified afterwards. */
@Getter
@Builder
public class SearchQuery {

  /** The query as typed by the caller. */
  private final String rawQuery;

  /** Free text matched against scene content and action lines. */
  private final String textQuery;

  private final String dialogue;
  private final String action;
  private final String parenthetical;

  @Singular private final List<String> characters;
  @Singular private final List<String> locations;

  /** Script title filter. */
  private final String project;

  private final Integer seasonStart;
  private final Integer seasonEnd;
  private final Integer episodeStart;
  private final Integer episodeEnd;

  @Builder.Default private final SearchMode mode = SearchMode.AUTO;
  @Builder.Default private final int limit = 5;
  @Builder.Default private final int offset = 0;

  @Builder.Default private final boolean includeBible = true;
  @Builder.Default private final boolean onlyBible = false;

  /** Text used for semantic matching: dialogue, then action, then free text. */
  public String getSemanticText() {
    if (hasText(dialogue)) {
      return dialogue;
    }
    if (hasText(action)) {
      return action;
    }
    return hasText(textQuery) ? textQuery : "";
  }

  public int getSemanticWordCount() {
    String text = getSemanticText().strip();
    return text.isEmpty() ? 0 : text.split("\\s+").length;
  }

  public boolean searchesBible() {
    return includeBible || onlyBible;
  }

  static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
