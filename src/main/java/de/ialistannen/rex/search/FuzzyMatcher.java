package de.ialistannen.rex.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;

/**
 * Fuzzy matching in the style of fzf: every query character has to appear in the target, in order, but not
 * necessarily next to each other.
 * <p>
 * Each matched character scores a base value plus a bonus if it starts the target or a word (after {@code / - _ . :}
 * or a lower to upper case change). The bonus of the first query character counts twice. Runs of consecutive matches
 * score extra, gaps between matches cost points. Of all possible alignments the best scoring one is used.
 */
public class FuzzyMatcher {

  private static final int SCORE_MATCH = 16;
  private static final int SCORE_GAP_START = -3;
  private static final int SCORE_GAP_EXTENSION = -1;
  private static final int BONUS_START = 10;
  private static final int BONUS_BOUNDARY = 8;
  private static final int BONUS_CAMEL_CASE = 7;
  private static final int BONUS_CONSECUTIVE = 4;
  private static final int BONUS_FIRST_CHAR_MULTIPLIER = 2;
  private static final int BONUS_EXACT = 16;
  private static final int NO_MATCH = Integer.MIN_VALUE / 2;

  private final CaseMatching caseMatching;

  public FuzzyMatcher(CaseMatching caseMatching) {
    this.caseMatching = caseMatching;
  }

  /**
   * Scores a single target.
   *
   * @param query the query. An empty query matches everything with a score of zero.
   * @param target the target
   * @return the score, empty if the target does not match
   */
  public OptionalInt score(String query, String target) {
    if (query.isEmpty()) {
      return OptionalInt.of(0);
    }
    if (query.length() > target.length()) {
      return OptionalInt.empty();
    }

    boolean ignoreCase = caseMatching.ignoresCase(query);
    char[] needle = fold(query, ignoreCase);
    char[] haystack = fold(target, ignoreCase);

    int[] bonus = new int[target.length()];
    for (int j = 0; j < target.length(); j++) {
      bonus[j] = positionBonus(target, j);
    }

    // previous[j]: best score with the previous query char matched exactly at j
    int[] previous = new int[target.length()];
    int[] current = new int[target.length()];
    for (int j = 0; j < target.length(); j++) {
      previous[j] = haystack[j] == needle[0]
        ? SCORE_MATCH + bonus[j] * BONUS_FIRST_CHAR_MULTIPLIER
        : NO_MATCH;
    }

    for (int i = 1; i < needle.length; i++) {
      char wanted = needle[i];
      // best over k <= j - 2 of previous[k] minus the gap between k and j
      int bestWithGap = NO_MATCH;
      for (int j = 0; j < target.length(); j++) {
        if (j >= 2) {
          bestWithGap = Math.max(
            bestWithGap + SCORE_GAP_EXTENSION,
            previous[j - 2] + SCORE_GAP_START
          );
        }
        if (j == 0 || haystack[j] != wanted) {
          current[j] = NO_MATCH;
          continue;
        }
        int consecutive = previous[j - 1] + BONUS_CONSECUTIVE;
        int best = Math.max(consecutive, bestWithGap);
        current[j] = best <= NO_MATCH / 2 ? NO_MATCH : best + SCORE_MATCH + bonus[j];
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }

    int best = NO_MATCH;
    for (int score : previous) {
      best = Math.max(best, score);
    }
    if (best <= NO_MATCH / 2) {
      return OptionalInt.empty();
    }
    if (Arrays.equals(haystack, needle)) {
      best += BONUS_EXACT;
    }
    return OptionalInt.of(Math.max(best, 1));
  }

  /**
   * Matches all targets.
   *
   * @param query the query
   * @param targets the targets
   * @return the matching targets, most relevant first
   */
  public List<SearchResult> search(String query, Collection<String> targets) {
    List<SearchResult> results = new ArrayList<>();
    for (String target : targets) {
      OptionalInt score = score(query, target);
      if (score.isPresent()) {
        results.add(new SearchResult(target, score.getAsInt()));
      }
    }
    results.sort(SearchResult.BY_RELEVANCE);
    return results;
  }

  private static char[] fold(String value, boolean ignoreCase) {
    char[] chars = value.toCharArray();
    if (ignoreCase) {
      for (int i = 0; i < chars.length; i++) {
        chars[i] = Character.toLowerCase(chars[i]);
      }
    }
    return chars;
  }

  private static int positionBonus(String target, int index) {
    if (index == 0) {
      return BONUS_START;
    }
    char before = target.charAt(index - 1);
    char at = target.charAt(index);
    if (isSeparator(before)) {
      return BONUS_BOUNDARY;
    }
    if (Character.isLowerCase(before) && Character.isUpperCase(at)) {
      return BONUS_CAMEL_CASE;
    }
    if (!Character.isDigit(before) && Character.isDigit(at)) {
      return BONUS_CAMEL_CASE;
    }
    return 0;
  }

  private static boolean isSeparator(char c) {
    return c == '/' || c == '-' || c == '_' || c == '.' || c == ':' || Character.isWhitespace(c);
  }
}
