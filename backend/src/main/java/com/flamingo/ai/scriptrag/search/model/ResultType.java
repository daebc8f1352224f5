package com.flamingo.ai.scriptrag.search.model;

/** Kind of entity a {@link SearchResult} points at. */
public enum ResultType {
  SCENE,
  DIALOGUE,
  ACTION,
  CHARACTER,
  LOCATION,
  OBJECT,
  BIBLE_CHUNK
}
