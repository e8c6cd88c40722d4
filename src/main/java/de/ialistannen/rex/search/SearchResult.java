package de.ialistannen.rex.search;

import java.util.Comparator;

/**
 * A matched name.
 *
 * @param value the name
 * @param score the relevance, higher is better
 */
public record SearchResult(String value, int score) {

  /**
   * Best score first, names with equal scores alphabetically.
   */
  public static final Comparator<SearchResult> BY_RELEVANCE = Comparator
    .comparingInt(SearchResult::score)
    .reversed()
    .thenComparing(SearchResult::value);
}
