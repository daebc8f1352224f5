package com.flamingo.ai.scriptrag.embedding.preprocess;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Preprocessor aware of screenplay formatting.
 *
 * <p>Steps, in order:
 *
 * <ol>
 *   <li>short all-caps lines (at most three words, usually character cues) become title case
 *   <li>parentheticals get one space on each side and no padding inside
 *   <li>transitions such as {@code CUT TO:} are isolated by blank lines
 *   <li>trailing whitespace is trimmed per line and runs of blank lines are collapsed
 * </ol>
 */
public class ScreenplayPreprocessor implements TextPreprocessor {

  static final List<String> TRANSITIONS =
      List.of("CUT TO:", "FADE IN:", "FADE OUT:", "DISSOLVE TO:");

  private static final int MAX_CUE_WORDS = 3;
  private static final Pattern PARENTHETICAL =
      Pattern.compile("[ \\t]*\\(\\s*([^()\\n]*?)\\s*\\)[ \\t]*");
  private static final Pattern TRANSITION =
      Pattern.compile(
          "[ \\t]*("
              + TRANSITIONS.stream().map(Pattern::quote).collect(Collectors.joining("|"))
              + ")[ \\t]*");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

  @Override
  public String process(String text) {
    String result = normalizeCharacterNames(text);
    result = normalizeParentheticals(result);
    result = isolateTransitions(result);
    return collapseWhitespace(result);
  }

  String normalizeCharacterNames(String text) {
    String[] lines = text.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String stripped = lines[i].strip();
      if (isCharacterCue(stripped)) {
        lines[i] = toTitleCase(stripped);
      }
    }
    return String.join("\n", lines);
  }

  String normalizeParentheticals(String text) {
    Matcher m = PARENTHETICAL.matcher(text);
    StringBuilder sb = new StringBuilder(text.length());
    int last = 0;
    while (m.find()) {
      sb.append(text, last, m.start());
      boolean atLineStart = m.start() == 0 || text.charAt(m.start() - 1) == '\n';
      boolean atLineEnd = m.end() == text.length() || text.charAt(m.end()) == '\n';
      if (!atLineStart) {
        sb.append(' ');
      }
      sb.append('(').append(m.group(1)).append(')');
      if (!atLineEnd) {
        sb.append(' ');
      }
      last = m.end();
    }
    sb.append(text, last, text.length());
    return sb.toString();
  }

  String isolateTransitions(String text) {
    Matcher m = TRANSITION.matcher(text);
    StringBuilder sb = new StringBuilder(text.length() + 16);
    int last = 0;
    while (m.find()) {
      sb.append(text, last, m.start());
      if (sb.length() > 0) {
        padNewlines(sb, trailingNewlines(sb));
      }
      sb.append(m.group(1));
      int after = m.end();
      int leading = leadingNewlines(text, after);
      if (after + leading < text.length()) {
        for (int i = leading; i < 2; i++) sb.append('\n');
      }
      last = after;
    }
    sb.append(text, last, text.length());
    return sb.toString();
  }

  String collapseWhitespace(String text) {
    String trimmed =
        text.lines().map(String::stripTrailing).collect(Collectors.joining("\n"));
    if (text.endsWith("\n")) {
      trimmed = trimmed + "\n";
    }
    return EXCESS_BLANK_LINES.matcher(trimmed).replaceAll("\n\n");
  }

  private static boolean isCharacterCue(String line) {
    if (line.isEmpty() || TRANSITIONS.contains(line)) {
      return false;
    }
    boolean hasLetter = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (Character.isLowerCase(c)) {
        return false;
      }
      hasLetter |= Character.isUpperCase(c);
    }
    return hasLetter && line.split("\\s+").length <= MAX_CUE_WORDS;
  }

  private static String toTitleCase(String line) {
    StringBuilder sb = new StringBuilder(line.length());
    boolean previousIsLetter = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
        previousIsLetter = true;
      } else {
        sb.append(c);
        previousIsLetter = false;
      }
    }
    return sb.toString();
  }

  private static void padNewlines(StringBuilder sb, int existing) {
    for (int i = existing; i < 2; i++) sb.append('\n');
  }

  private static int trailingNewlines(StringBuilder sb) {
    int count = 0;
    for (int i = sb.length() - 1; i >= 0 && sb.charAt(i) == '\n' && count < 2; i--) count++;
    return count;
  }

  private static int leadingNewlines(String text, int from) {
    int count = 0;
    for (int i = from; i < text.length() && text.charAt(i) == '\n' && count < 2; i++) count++;
    return count;
  }
}
