package com.flamingo.ai.scriptrag.embedding.preprocess;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A single text transform applied before embedding. Steps run in the order the caller lists. */
public enum PreprocessingStep {
  LOWERCASE {
    @Override
    public String apply(String text, int maxTextLength) {
      return text.toLowerCase(Locale.ROOT);
    }
  },

  /** Removes ASCII punctuation characters. */
  REMOVE_PUNCTUATION {
    @Override
    public String apply(String text, int maxTextLength) {
      return PUNCTUATION.matcher(text).replaceAll("");
    }
  },

  /** Collapses every whitespace run, including newlines, to a single space and trims. */
  REMOVE_EXTRA_WHITESPACE {
    @Override
    public String apply(String text, int maxTextLength) {
      return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }
  },

  /** Compatibility decomposition (NFKD). */
  NORMALIZE_UNICODE {
    @Override
    public String apply(String text, int maxTextLength) {
      return Normalizer.normalize(text, Normalizer.Form.NFKD);
    }
  },

  REMOVE_URLS {
    @Override
    public String apply(String text, int maxTextLength) {
      return URL.matcher(text).replaceAll("");
    }
  },

  REMOVE_EMAILS {
    @Override
    public String apply(String text, int maxTextLength) {
      return EMAIL.matcher(text).replaceAll("");
    }
  },

  REMOVE_NUMBERS {
    @Override
    public String apply(String text, int maxTextLength) {
      return DIGITS.matcher(text).replaceAll("");
    }
  },

  /** Cuts to {@code maxTextLength} characters, appending {@code ...} only when text was cut. */
  TRUNCATE {
    @Override
    public String apply(String text, int maxTextLength) {
      return truncate(text, maxTextLength);
    }
  },

  EXPAND_CONTRACTIONS {
    @Override
    public String apply(String text, int maxTextLength) {
      String result = text;
      for (Map.Entry<Pattern, String> contraction : CONTRACTIONS.entrySet()) {
        result =
            contraction
                .getKey()
                .matcher(result)
                .replaceAll(Matcher.quoteReplacement(contraction.getValue()));
      }
      return result;
    }
  };

  public static final String ELLIPSIS = "...";

  private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern URL = Pattern.compile("https?://\\S+|www\\.\\S+");
  private static final Pattern EMAIL = Pattern.compile("\\S+@\\S+");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  // Full forms first so "won't" is not turned into "wo not".
  private static final Map<Pattern, String> CONTRACTIONS = new LinkedHashMap<>();

  static {
    contraction("don't", "do not");
    contraction("won't", "will not");
    contraction("can't", "cannot");
    contraction("n't", " not");
    contraction("'re", " are");
    contraction("'ve", " have");
    contraction("'ll", " will");
    contraction("'d", " would");
    contraction("'m", " am");
  }

  private static void contraction(String form, String expansion) {
    CONTRACTIONS.put(Pattern.compile(Pattern.quote(form), Pattern.CASE_INSENSITIVE), expansion);
  }

  /**
   * Applies this step.
   *
   * @param text input text
   * @param maxTextLength length limit used by {@link #TRUNCATE}
   * @return transformed text
   */
  public abstract String apply(String text, int maxTextLength);

  static String truncate(String text, int maxTextLength) {
    if (text.length() <= maxTextLength) {
      return text;
    }
    return text.substring(0, maxTextLength) + ELLIPSIS;
  }
}
