package com.flamingo.ai.researchcache.service.chunking;

import java.util.List;

/**
 * Picks a natural break shortly before a target offset. Looks back at most {@value #LOOKBACK}
 * characters and prefers, in order: paragraph break, sentence end, other punctuation, whitespace.
 * Within one class the latest break wins; with no break at all the cut is at the target.
 */
final class SplitPointFinder {

  static final int LOOKBACK = 100;

  private static final List<List<String>> PRIORITY_CLASSES =
      List.of(
          List.of("\n\n"),
          List.of(". ", "! ", "? ", ".\n", "!\n", "?\n"),
          List.of(", ", "; ", ": ", ",\n", ";\n", ":\n"));

  private SplitPointFinder() {}

  /**
   * @param text the full text
   * @param from start of the current chunk; the result is always greater than this
   * @param target absolute offset the chunk should not pass
   * @return absolute split offset in {@code (from, target]}, or {@code text.length()} when the
   *     remaining text fits
   */
  static int find(String text, int from, int target) {
    if (target >= text.length()) {
      return text.length();
    }
    int windowStart = Math.max(from, target - LOOKBACK);
    for (List<String> patterns : PRIORITY_CLASSES) {
      int best = -1;
      for (String pattern : patterns) {
        int idx = lastIndexIn(text, pattern, windowStart, target);
        if (idx >= 0) {
          best = Math.max(best, idx + pattern.length());
        }
      }
      if (best > from) {
        return best;
      }
    }
    for (int i = target - 1; i >= windowStart; i--) {
      if (Character.isWhitespace(text.charAt(i)) && i + 1 > from) {
        return i + 1;
      }
    }
    return target;
  }

  /** Last index of {@code pattern} lying entirely inside {@code [start, end)}. */
  private static int lastIndexIn(String text, String pattern, int start, int end) {
    int idx = text.lastIndexOf(pattern, end - pattern.length());
    return idx >= start ? idx : -1;
  }
}
