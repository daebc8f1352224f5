package com.flamingo.ai.scriptrag.search.model;

/** Whether a query may be answered with vector similarity in addition to SQL. */
public enum SearchMode {
  /** Semantic search only for queries long enough to benefit from it. */
  AUTO,
  /** SQL only. */
  STRICT,
  /** Always add semantic search. */
  FUZZY
}
