package com.flamingo.ai.scriptrag.embedding.preprocess;

import java.util.List;

/** Applies a caller-ordered list of {@link PreprocessingStep}s. */
public class StandardPreprocessor implements TextPreprocessor {

  public static final List<PreprocessingStep> DEFAULT_STEPS =
      List.of(PreprocessingStep.REMOVE_EXTRA_WHITESPACE, PreprocessingStep.NORMALIZE_UNICODE);

  public static final int DEFAULT_MAX_TEXT_LENGTH = 8000;

  private final List<PreprocessingStep> steps;
  private final int maxTextLength;

  public StandardPreprocessor() {
    this(null, DEFAULT_MAX_TEXT_LENGTH);
  }

  public StandardPreprocessor(List<PreprocessingStep> steps) {
    this(steps, DEFAULT_MAX_TEXT_LENGTH);
  }

  /**
   * @param steps steps in application order; null or empty selects {@link #DEFAULT_STEPS}
   * @param maxTextLength limit used by {@link PreprocessingStep#TRUNCATE}
   */
  public StandardPreprocessor(List<PreprocessingStep> steps, int maxTextLength) {
    this.steps = steps == null || steps.isEmpty() ? DEFAULT_STEPS : List.copyOf(steps);
    this.maxTextLength = maxTextLength;
  }

  public List<PreprocessingStep> getSteps() {
    return steps;
  }

  @Override
  public String process(String text) {
    String result = text;
    for (PreprocessingStep step : steps) {
      result = step.apply(result, maxTextLength);
    }
    return result;
  }
}
