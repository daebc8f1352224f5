package com.flamingo.ai.scriptrag.embedding.preprocess;

/** Normalizes text before it is embedded or used as a cache key. */
public interface TextPreprocessor {

  String process(String text);
}
